package odec;

import odec.trans.OutputFormat;
import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class OdecOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Print the version and exit")
	public boolean version = false;

	@Option(value = "-h Print usage information")
	public boolean help = false;

	@Option(value = "-q Only report warnings and errors")
	public boolean quiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution")
	public boolean verbose = false;

	@Option(value = "-d Wait for Enter before translating, to attach a debugger")
	public boolean debug = false;

	@Option(value = "-x Print the scope tree before translating")
	public boolean printParse = false;

	@Option(value = "-p Encode state variables as parameters instead of species")
	public boolean useParameters = false;

	@Option(value = "-f Output format, sbml or xpp")
	public String format;

	@Option(value = "-o Write the model to this file instead of standard output")
	public String output;

	@Option(value = "-c Path to the configuration file, if any")
	public String config;

	public String inputFilePath;

	// resolved from the command line and the JSON configuration file
	public OutputFormat outputFormat = OutputFormat.SBML;
	public String outputFilePath;
	public boolean useSpecies = true;

	private final Options plumeOptions;
	private final String[] args;

	public OdecOptions(String[] args) {
		this.plumeOptions = new Options("odec [options] scope-tree.json", this);
		this.args = args;
	}

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public void parse() throws OdecOptionException {
		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new OdecOptionException(e.getMessage());
		}

		if (version || help) {
			return;
		}

		if (remainingArgs.length != 1) {
			throw new OdecOptionException("expected exactly one scope tree file, found " + remainingArgs.length);
		}
		inputFilePath = remainingArgs[0];

		if (config != null && !config.isEmpty()) {
			readConfig(config);
		}

		if (useParameters) {
			useSpecies = false;
		}
		if (format != null) {
			outputFormat = parseFormat(format);
		}
		if (output != null) {
			outputFilePath = output;
		}
	}

	private static OutputFormat parseFormat(String name) throws OdecOptionException {
		OutputFormat result = OutputFormat.fromName(name);
		if (result == null) {
			throw new OdecOptionException("unknown output format " + name + ", expected sbml or xpp");
		}
		return result;
	}

	private void readConfig(String path) throws OdecOptionException {
		String s;
		try {
			s = FileUtils.readFileToString(new File(path), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new OdecOptionException("Error reading configuration file: " + ex.getMessage());
		}

		try {
			JSONObject json = new JSONObject(s);
			JSONObject translation = json.optJSONObject("translation");
			if (translation != null && translation.has("use_species")) {
				useSpecies = translation.getBoolean("use_species");
			}
			JSONObject out = json.optJSONObject("output");
			if (out != null) {
				if (out.has("format")) {
					outputFormat = parseFormat(out.getString("format"));
				}
				if (out.has("dest_file")) {
					outputFilePath = out.getString("dest_file");
				}
			}
		} catch (JSONException e) {
			throw new OdecOptionException(path + ": parsing error: " + e.getMessage());
		}
	}
}
