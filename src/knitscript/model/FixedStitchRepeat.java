package knitscript.model;

import knitscript.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A sequence of stitches worked a fixed number of times.
 */
public class FixedStitchRepeat extends Knittable {
	private final List<Node> stitches;
	private final Node times;

	public FixedStitchRepeat(SourceLocation location, List<Node> stitches, Node times) {
		super(location);
		this.stitches = Collections.unmodifiableList(stitches);
		this.times = times;
	}

	public List<Node> getStitches() {
		return stitches;
	}

	public Node getTimes() {
		return times;
	}

	public FixedStitchRepeat withStitches(List<Node> newStitches) {
		return new FixedStitchRepeat(getLocation(), newStitches, times);
	}

	@Override
	protected StitchCounts deriveCounts() {
		Integer n = natural(times);
		StitchCounts unit = sum(stitches);
		if (n == null || unit == null) {
			return null;
		}
		return unit.times(n);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(stitches, times);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		FixedStitchRepeat other = (FixedStitchRepeat) obj;
		return stitches.equals(other.stitches) && Objects.equals(times, other.times);
	}
}
