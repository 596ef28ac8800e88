package mixfix;

import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.util.Arrays;
import java.util.List;

public class MixfixOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Print the version and exit", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean logLvlVerbose = false;

	@Option(value = "-t Path to the JSON operator table", aliases = {"-table"})
	public String tableFilePath;

	@Option(value = "-s Scope the expressions are parsed in", aliases = {"-scope"})
	public String scope = "main";

	@Option(value = "-d Print parse trees in display form rather than as nested nodes", aliases = {"-display"})
	public boolean display = false;

	public List<String> expressionFilePaths;

	private final Options plumeOptions;
	private final String[] args;

	public MixfixOptions(String[] args) {
		this.plumeOptions = new Options("mixfix [options] -t table expression-file...", this);
		this.args = args;
	}

	public void printHelp() {
		plumeOptions.printUsage();
	}

	/**
	 * @return false if the driver should stop without doing anything, after --help or --version
	 */
	public boolean parse() throws MixfixOptionException {
		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new MixfixOptionException(e.getMessage());
		}

		if (version) {
			System.out.println("mixfix version " + VERSION);
			return false;
		}

		if (help) {
			printHelp();
			return false;
		}

		if (tableFilePath == null || tableFilePath.isEmpty()) {
			throw new MixfixOptionException("An operator table is required");
		}
		if (remainingArgs.length == 0) {
			throw new MixfixOptionException("At least one expression file is required");
		}
		expressionFilePaths = Arrays.asList(remainingArgs);
		return true;
	}
}
