package knitscript.modules;

import knitscript.errors.Issue;
import knitscript.model.*;
import knitscript.parser.AstReadException;
import knitscript.parser.JsonAstReader;
import knitscript.trans.Builtins;
import knitscript.trans.passes.substitution.EnclosePass;
import knitscript.trans.passes.substitution.SubstitutionPass;
import knitscript.trans.passes.substitution.UnboundNameIssue;
import org.apache.commons.io.FilenameUtils;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Evaluates the statements of a document into the environment of patterns it defines.
 *
 * A {@code using} statement names a module, which is another document stored as
 * {@code <module>.json} in the directory of the document that uses it or in one of the lookup
 * paths. Modules are evaluated without output, and each at most once per call to {@link #load}.
 */
public class DocumentLoader {

	private static final Logger logger = Logger.getLogger("knitscript.loader");

	private final List<Path> lookupPaths;
	private final PrintStream out;
	private final boolean annotateRows;

	private final Map<Path, Map<String, Node>> loaded = new HashMap<>();
	// insertion order is the chain of modules currently being loaded
	private final LinkedHashMap<Path, String> loading = new LinkedHashMap<>();

	public DocumentLoader(List<Path> lookupPaths, PrintStream out, boolean annotateRows) {
		this.lookupPaths = lookupPaths;
		this.out = out;
		this.annotateRows = annotateRows;
	}

	public DocumentLoader(List<Path> lookupPaths, PrintStream out) {
		this(lookupPaths, out, false);
	}

	/**
	 * Loads a document, running its top-level calls with output going to this loader's stream.
	 *
	 * @return every name bound by the document, built-ins included
	 * @throws Issue if a pattern cannot be evaluated
	 */
	public Map<String, Node> load(Path path) throws IOException, AstReadException, ModuleLoadError {
		loaded.clear();
		loading.clear();
		return loadDocument(path, out);
	}

	/**
	 * @param dir the directory of the document doing the lookup, which is searched first
	 */
	public Path findModule(String name, Path dir) throws ModuleNotFoundError {
		List<Path> checked = new ArrayList<>();
		if (dir != null) {
			checked.add(dir);
		}
		checked.addAll(lookupPaths);
		for (Path p : checked) {
			Path result = p.resolve(name + ".json");
			if (result.toFile().exists()) {
				return result;
			}
		}
		throw new ModuleNotFoundError(name, checked);
	}

	private Map<String, Node> loadDocument(Path path, PrintStream output)
			throws IOException, AstReadException, ModuleLoadError {
		Path key = path.toAbsolutePath().normalize();
		String name = FilenameUtils.getBaseName(key.toString());
		if (loading.containsKey(key)) {
			List<String> chain = new ArrayList<>();
			boolean inCycle = false;
			for (Map.Entry<Path, String> entry : loading.entrySet()) {
				inCycle |= entry.getKey().equals(key);
				if (inCycle) {
					chain.add(entry.getValue());
				}
			}
			chain.add(name);
			throw new CircularModuleReferenceIssue(chain);
		}
		Map<String, Node> cached = loaded.get(key);
		if (cached != null) {
			logger.fine("reusing module " + name);
			return cached;
		}

		logger.fine("loading " + key);
		Document document = JsonAstReader.readDocument(key);
		Map<String, Node> env = new HashMap<>(Builtins.defaultEnvironment(output, annotateRows));
		loading.put(key, name);
		try {
			StatementEvaluator evaluator = new StatementEvaluator(env, key.getParent(), output);
			for (Statement statement : document.getStatements()) {
				statement.accept(evaluator);
			}
		} finally {
			loading.remove(key);
		}
		Map<String, Node> result = Collections.unmodifiableMap(env);
		loaded.put(key, result);
		return result;
	}

	private class StatementEvaluator extends StatementVisitor<Void, ModuleLoadError> {
		private final Map<String, Node> env;
		private final Path dir;
		private final PrintStream output;

		StatementEvaluator(Map<String, Node> env, Path dir, PrintStream output) {
			this.env = env;
			this.dir = dir;
			this.output = output;
		}

		@Override
		public Void visit(UsingStatement usingStatement) throws ModuleLoadError {
			String module = usingStatement.getModule();
			Map<String, Node> moduleEnv;
			try {
				moduleEnv = loadDocument(findModule(module, dir), null);
			} catch (ModuleNotFoundError | IOException | AstReadException e) {
				throw new ModuleLoadError(module, e);
			} catch (Issue issue) {
				throw issue.withContext(new WhileLoadingModule(usingStatement));
			}
			for (String name : usingStatement.getNames()) {
				Node value = moduleEnv.get(name);
				if (value == null) {
					throw new UnboundNameIssue(new VarRef(usingStatement.getLocation(), name));
				}
				env.put(name, value);
			}
			return null;
		}

		@Override
		public Void visit(PatternDefinition patternDefinition) {
			// later definitions must not leak into this pattern, so it closes over a snapshot
			Node enclosed = EnclosePass.perform(patternDefinition.getPattern(), new HashMap<>(env));
			if (enclosed instanceof Pattern) {
				enclosed = ((Pattern) enclosed).withName(patternDefinition.getName());
			}
			env.put(patternDefinition.getName(), enclosed);
			return null;
		}

		@Override
		public Void visit(CallStatement callStatement) {
			Node result = SubstitutionPass.performCall(callStatement.getCall(), env);
			if (result != null) {
				logger.warning("discarding result of top-level call " + callStatement.getCall());
			}
			return null;
		}
	}

}
