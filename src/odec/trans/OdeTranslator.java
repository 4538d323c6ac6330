package odec.trans;

import odec.errors.IssueContext;
import odec.model.bio.OdeModel;
import odec.scope.Scope;
import odec.trans.naming.NamingScheme;
import odec.trans.passes.assemble.ModelAssemblyPass;
import odec.trans.passes.emit.ModelBuilderIssue;
import odec.trans.passes.emit.SbmlEmitPass;
import odec.trans.passes.emit.XppEmitPass;
import odec.trans.passes.emit.sbml.ModelBuilderException;
import odec.trans.passes.emit.sbml.SbmlModelBuilder;

import java.util.logging.Logger;

/**
 * Entry point of the translation library: scope tree in, model text out.
 */
public class OdeTranslator {

	private static final Logger logger = Logger.getLogger("odec.trans");

	public static final String DEFAULT_MODEL_ID = "odec_model";

	private OdeTranslator() {}

	/**
	 * Assembles the abstract model with a fresh {@link TranslationContext}.
	 *
	 * @return the model, or null if errors were reported to ctx
	 */
	public static OdeModel assemble(IssueContext ctx, Scope root, boolean useSpecies) {
		TranslationContext translation = new TranslationContext(NamingScheme.forScope(root));
		logger.fine("using separator " + translation.getNaming().getSeparator());
		return ModelAssemblyPass.perform(ctx, translation, root, useSpecies);
	}

	public static String emit(IssueContext ctx, OdeModel model, OutputFormat format, String modelId) {
		switch (format) {
			case XPP:
				logger.info("Writing XPP model");
				return XppEmitPass.perform(model);
			case SBML:
				logger.info("Writing SBML model");
				SbmlModelBuilder builder;
				try {
					builder = new SbmlModelBuilder(modelId);
				} catch (ModelBuilderException e) {
					ctx.error(new ModelBuilderIssue("create model " + modelId, e));
					return null;
				}
				return SbmlEmitPass.perform(ctx, model, builder);
			default:
				throw new IllegalArgumentException("unknown output format " + format);
		}
	}

	/**
	 * @return the serialized model, or null if errors were reported to ctx
	 */
	public static String translate(IssueContext ctx, Scope root, boolean useSpecies, OutputFormat format,
								   String modelId) {
		OdeModel model = assemble(ctx, root, useSpecies);
		if (ctx.hasErrors()) {
			return null;
		}
		return emit(ctx, model, format, modelId);
	}
}
