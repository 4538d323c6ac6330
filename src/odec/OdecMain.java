package odec;

import odec.errors.TopLevelIssueContext;
import odec.formatters.ScopeFormatter;
import odec.scope.Scope;
import odec.trans.IOErrorIssue;
import odec.trans.OdeTranslator;
import odec.trans.OdecTransException;
import odec.trans.passes.parse.ScopeTreeParsingPass;
import odec.trans.passes.parse.option.OptionParsingPass;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.logging.Logger;

public class OdecMain {
	private final String[] cmdArgs;
	private static final Logger logger = Logger.getLogger("odec");

	public OdecMain(String[] args) {
		cmdArgs = args;
	}

	public static void main(String[] args) {
		if (new OdecMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	/**
	 * Model ids must be valid SBML identifiers, so anything else in the file name becomes '_'.
	 */
	static String modelId(String inputFilePath) {
		String base = FilenameUtils.getBaseName(inputFilePath).replaceAll("[^A-Za-z0-9_]", "_");
		if (base.isEmpty()) {
			return OdeTranslator.DEFAULT_MODEL_ID;
		}
		if (Character.isDigit(base.charAt(0))) {
			return "_" + base;
		}
		return base;
	}

	// Top-level workhorse method.
	public boolean run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		try {
			// Check options, set up logging.
			OdecOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
			if (ctx.hasErrors()) {
				System.err.println(ctx.format());
				opts.printHelp();
				return false;
			}
			if (opts.version) {
				System.out.println("odec version " + OdecOptions.VERSION);
				return true;
			}
			if (opts.help) {
				opts.printHelp();
				return true;
			}

			if (opts.debug) {
				System.err.println("Press Enter to start the translation");
				System.in.read();
			}

			logger.info("Reading scope tree from \"" + opts.inputFilePath + "\"");
			Scope root = ScopeTreeParsingPass.perform(ctx, Paths.get(opts.inputFilePath));
			checkErrors(ctx);

			if (opts.printParse) {
				System.out.print(ScopeFormatter.format(root));
			}

			String result = OdeTranslator.translate(ctx, root, opts.useSpecies, opts.outputFormat,
					modelId(opts.inputFilePath));
			checkErrors(ctx);
			if (!ctx.getWarnings().isEmpty()) {
				logger.info("Skipped " + ctx.getWarnings().size() + " unsupported binding(s)");
			}

			if (opts.outputFilePath != null) {
				logger.info("Writing model to \"" + opts.outputFilePath + "\"");
				FileUtils.writeStringToFile(new File(opts.outputFilePath), result, StandardCharsets.UTF_8);
			} else {
				System.out.print(result);
				System.out.flush();
			}
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			System.err.println(ctx.format());
			return false;
		} catch (OdecTransException e) {
			logger.severe("found issues");
			System.err.println(e.getMsg());
			return false;
		}
		return true;
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws OdecTransException {
		if (ctx.hasErrors()) {
			throw new OdecTransException(ctx.format());
		}
	}
}
