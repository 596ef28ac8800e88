package mixfix.config;

import mixfix.MixfixOptionException;
import mixfix.MixfixOptions;
import mixfix.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	/**
	 * @return the parsed options, or null if the driver has nothing more to do
	 */
	public static MixfixOptions perform(IssueContext ctx, Logger logger, String[] args) {
		MixfixOptions opts = new MixfixOptions(args);
		boolean proceed = false;
		try {
			proceed = opts.parse();
		} catch (MixfixOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		Level level;
		if (opts.logLvlQuiet) {
			level = Level.WARNING;
		} else if (opts.logLvlVerbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(level);
		}
		return proceed || ctx.hasErrors() ? opts : null;
	}
}
