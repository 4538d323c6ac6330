package odec.trans.passes.parse.option;

import odec.OdecOptionException;
import odec.OdecOptions;
import odec.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static OdecOptions perform(IssueContext ctx, Logger logger, String[] args) {
		OdecOptions opts = new OdecOptions(args);
		try {
			opts.parse();
		} catch (OdecOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		Level level;
		if (opts.quiet) {
			level = Level.WARNING;
		} else if (opts.verbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(level);
		}
		return opts;
	}
}
