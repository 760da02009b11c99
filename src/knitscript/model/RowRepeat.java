package knitscript.model;

import knitscript.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A sequence of rows worked a fixed number of times.
 */
public class RowRepeat extends Knittable {
	private final List<Node> rows;
	private final Node times;

	public RowRepeat(SourceLocation location, List<Node> rows, Node times) {
		super(location);
		this.rows = Collections.unmodifiableList(rows);
		this.times = times;
	}

	public List<Node> getRows() {
		return rows;
	}

	public Node getTimes() {
		return times;
	}

	public RowRepeat withRows(List<Node> newRows) {
		return new RowRepeat(getLocation(), newRows, times);
	}

	@Override
	protected StitchCounts deriveCounts() {
		if (natural(times) == null) {
			return null;
		}
		return chain(rows);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(rows, times);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RowRepeat other = (RowRepeat) obj;
		return rows.equals(other.rows) && Objects.equals(times, other.times);
	}
}
