package knitscript;

import knitscript.errors.Issue;
import knitscript.model.Node;
import knitscript.model.Pattern;
import knitscript.modules.DocumentLoader;
import knitscript.modules.ModuleLoadError;
import knitscript.parser.AstReadException;
import knitscript.trans.Interpreter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class KnitScriptMain {
	private static final Logger logger = Logger.getLogger("knitscript");

	private final String[] cmdArgs;
	private final PrintStream out;
	private final PrintStream err;

	public KnitScriptMain(String[] args, PrintStream out, PrintStream err) {
		cmdArgs = args;
		this.out = out;
		this.err = err;
	}

	public KnitScriptMain(String[] args) {
		this(args, System.out, System.err);
	}

	public static void main(String[] args) {
		if (!new KnitScriptMain(args).run()) {
			System.exit(1);
		}
	}

	private static void setLogLevel(Level level) {
		logger.setLevel(level);
		// the console handler filters on its own level, which defaults to INFO
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			if (level.intValue() < handler.getLevel().intValue()) {
				handler.setLevel(level);
			}
		}
	}

	// Top-level workhorse method.
	public boolean run() {
		KnitScriptOptions opts = new KnitScriptOptions(cmdArgs);
		if (opts.version) {
			out.println("KnitScript version " + KnitScriptOptions.VERSION);
			return true;
		}
		if (opts.help) {
			opts.printHelp();
			return true;
		}
		try {
			opts.parse();
		} catch (KnitScriptOptionException e) {
			err.println(e.getMessage());
			opts.printHelp();
			return false;
		}

		// set the logger's log level based on command line arguments
		if (opts.logLvlQuiet) {
			setLogLevel(Level.WARNING);
		} else if (opts.logLvlVerbose) {
			setLogLevel(Level.FINE);
		} else {
			setLogLevel(Level.INFO);
		}

		Map<String, Pattern> patterns;
		try {
			logger.info("Loading document \"" + opts.inputFilePath + "\"");
			DocumentLoader loader = new DocumentLoader(opts.lookupPaths, out, opts.annotateRows);
			Map<String, Node> env = loader.load(Paths.get(opts.inputFilePath));
			patterns = selectPatterns(env, opts.patternName);
		} catch (IOException | AstReadException | ModuleLoadError | KnitScriptOptionException e) {
			logger.severe("could not load document");
			err.println(e.getMessage());
			return false;
		} catch (Issue issue) {
			logger.severe("found issues");
			err.println(issue.getMessage());
			return false;
		}

		boolean ok = true;
		for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
			ok &= render(entry.getKey(), entry.getValue(), opts.annotateRows);
		}

		logger.info(ok ? "Finished" : "Terminated with errors");
		return ok;
	}

	private static Map<String, Pattern> selectPatterns(Map<String, Node> env, String name)
			throws KnitScriptOptionException {
		Map<String, Pattern> selected = new TreeMap<>();
		if (name != null) {
			Node node = env.get(name);
			if (!(node instanceof Pattern) || !((Pattern) node).getParams().isEmpty()) {
				throw new KnitScriptOptionException("no pattern without parameters named \"" + name + "\"");
			}
			selected.put(name, (Pattern) node);
			return selected;
		}
		for (Map.Entry<String, Node> entry : env.entrySet()) {
			if (entry.getValue() instanceof Pattern && ((Pattern) entry.getValue()).getParams().isEmpty()) {
				selected.put(entry.getKey(), (Pattern) entry.getValue());
			}
		}
		return selected;
	}

	private boolean render(String name, Pattern pattern, boolean annotateRows) {
		logger.info("Preparing pattern " + name);
		Pattern prepared;
		try {
			prepared = Interpreter.preparePattern(pattern);
		} catch (Issue issue) {
			err.println(name + ": " + issue.getMessage());
			return false;
		}

		logger.info("Verifying pattern " + name);
		List<Issue> issues = Interpreter.verify(prepared);

		out.println(name + ":");
		out.println(Interpreter.export(prepared, annotateRows));
		out.println();
		for (Issue issue : issues) {
			out.println("error: " + issue.getMessage());
		}
		return issues.isEmpty();
	}
}
