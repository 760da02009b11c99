package knitscript;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class KnitScriptOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Version", aliases = {"-version"})
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

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	@Option(value = "-p name of the pattern to render (default: every pattern without parameters)")
	public String patternName;

	@Option(value = "-a annotate each row with its side and stitch count")
	public boolean annotateRows = false;

	public String inputFilePath;

	// fields extracted from the JSON configuration file
	public List<Path> lookupPaths = new ArrayList<>();

	private final Options plumeOptions;
	private final String[] remainingArgs;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public KnitScriptOptions(String[] args) {
		plumeOptions = new Options("knitscript [options] document.json", this);
		remainingArgs = plumeOptions.parse(true, args);
	}

	/**
	 * Checks the command line and reads the configuration file it names, if any. Options given on
	 * the command line take precedence over the configuration file.
	 */
	public void parse() throws KnitScriptOptionException {
		if (remainingArgs.length != 1) {
			throw new KnitScriptOptionException("expected exactly one document, found " + remainingArgs.length);
		}
		inputFilePath = remainingArgs[0];

		if (configFilePath == null || configFilePath.isEmpty()) {
			return;
		}

		String s;
		try {
			s = FileUtils.readFileToString(Paths.get(configFilePath).toFile(), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new KnitScriptOptionException("Error reading configuration file: " + ex.getMessage());
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new KnitScriptOptionException(configFilePath + ": parsing error: " + e.getMessage());
		}

		try {
			readConfig(config, Paths.get(configFilePath).toAbsolutePath().getParent());
		} catch (JSONException e) {
			throw new KnitScriptOptionException(configFilePath + ": " + e.getMessage());
		}
	}

	private void readConfig(JSONObject config, Path configDir) {
		JSONArray paths = config.optJSONArray("lookup_paths");
		if (paths != null) {
			for (int i = 0; i < paths.length(); i++) {
				// relative lookup paths are relative to the configuration file
				lookupPaths.add(configDir.resolve(paths.getString(i)).normalize());
			}
		}
		JSONObject export = config.optJSONObject("export");
		if (export != null && !annotateRows) {
			annotateRows = export.optBoolean("annotate_rows", false);
		}
	}
}
