package knitscript.model;

import knitscript.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A sequence of rows worked once, optionally taking parameters.
 *
 * A pattern bound by a definition carries the environment it was defined in, so that its free
 * names keep their meaning wherever it is called from. The environment and the name are not part
 * of a pattern's structural identity.
 */
public class Pattern extends Knittable {
	private final List<Node> rows;
	private final List<String> params;
	private final Map<String, Node> env;
	private final String name;

	public Pattern(SourceLocation location, List<Node> rows, List<String> params, Map<String, Node> env) {
		this(location, rows, params, env, null);
	}

	public Pattern(SourceLocation location, List<Node> rows, List<String> params, Map<String, Node> env,
	               String name) {
		super(location);
		this.rows = Collections.unmodifiableList(rows);
		this.params = Collections.unmodifiableList(params);
		this.env = env == null ? null : Collections.unmodifiableMap(env);
		this.name = name;
	}

	public List<Node> getRows() {
		return rows;
	}

	public List<String> getParams() {
		return params;
	}

	/**
	 * @return the captured environment, or null if the pattern has not been enclosed
	 */
	public Map<String, Node> getEnv() {
		return env;
	}

	/**
	 * @return the name the pattern was defined under, or null for anonymous patterns
	 */
	public String getName() {
		return name;
	}

	public Pattern withRows(List<Node> newRows) {
		return new Pattern(getLocation(), newRows, params, env, name);
	}

	public Pattern withParams(List<String> newParams) {
		return new Pattern(getLocation(), rows, newParams, env, name);
	}

	public Pattern withEnv(Map<String, Node> newEnv) {
		return new Pattern(getLocation(), rows, params, newEnv, name);
	}

	public Pattern withName(String newName) {
		return new Pattern(getLocation(), rows, params, env, newName);
	}

	public RowRepeat toRowRepeat() {
		return new RowRepeat(getLocation(), rows, new NaturalLit(getLocation(), 1));
	}

	@Override
	protected StitchCounts deriveCounts() {
		return chain(rows);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(rows, params);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		Pattern other = (Pattern) obj;
		return rows.equals(other.rows) && params.equals(other.params);
	}
}
