package odec.trans.passes.emit;

import odec.formatters.FormattingTools;
import odec.formatters.IndentingWriter;
import odec.model.bio.InitialAssignment;
import odec.model.bio.ModelEntity;
import odec.model.bio.OdeModel;
import odec.model.bio.Parameter;
import odec.model.bio.RateRule;
import odec.model.bio.Species;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Writes an assembled model as an XPP ODE file. Compartments have no XPP counterpart and
 * are left out.
 */
public class XppEmitPass {

	public static final String HEADER = "#\n# This file is generated by odec\n#\n\n";

	private XppEmitPass() {}

	public static String perform(OdeModel model) {
		StringWriter w = new StringWriter();
		try {
			write(model, new IndentingWriter(w));
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

	private static boolean isDefinedByRule(OdeModel model, ModelEntity entity) {
		if (entity instanceof Species) {
			return true;
		}
		return entity instanceof Parameter && !((Parameter) entity).isConstant()
				&& model.getRateRule(entity.getId()).isPresent();
	}

	private static String valueOf(OdeModel model, Parameter parameter) {
		Optional<InitialAssignment> assignment = model.getInitialAssignment(parameter.getId());
		if (assignment.isPresent()) {
			return assignment.get().getFormula();
		}
		return FormattingTools.formatValue(parameter.getValue());
	}

	private static double initialValue(ModelEntity entity) {
		if (entity instanceof Species) {
			return ((Species) entity).getValue();
		}
		return ((Parameter) entity).getValue();
	}

	public static void write(OdeModel model, IndentingWriter out) throws IOException {
		out.write(HEADER);

		List<ModelEntity> ruleDefined = new ArrayList<>();
		for (ModelEntity entity : model.getEntities()) {
			if (isDefinedByRule(model, entity)) {
				ruleDefined.add(entity);
			} else if (entity instanceof Parameter) {
				Parameter parameter = (Parameter) entity;
				out.write("# Parameter id = " + parameter.getId());
				out.writeLine(parameter.isConstant() ? ", constant" : ", non-constant but no rule supplied");
				out.writeLine("par " + parameter.getId() + "=" + valueOf(model, parameter));
				out.newLine();
			}
		}

		for (ModelEntity entity : ruleDefined) {
			String id = entity.getId();
			String formula = model.getRateRule(id).map(RateRule::getFormula).orElse("0");
			out.writeLine("# rateRule : variable = " + id);
			out.writeLine("init " + id + "=" + FormattingTools.formatValue(initialValue(entity)));
			out.writeLine("d" + id + "/dt=" + formula);
			out.newLine();
		}

		for (ModelEntity entity : ruleDefined) {
			String kind = entity instanceof Species ? "Species" : "Parameter";
			out.writeLine("# " + kind + ":   id = " + entity.getId() + ", defined by rule");
			out.newLine();
		}
	}
}
