package knitscript.model;

import knitscript.util.SourceLocation;

import java.util.Objects;

/**
 * A block repeated horizontally a fixed number of times.
 */
public class FixedBlockRepeat extends Knittable {
	private final Node block;
	private final Node times;

	public FixedBlockRepeat(SourceLocation location, Node block, Node times) {
		super(location);
		this.block = block;
		this.times = times;
	}

	public Node getBlock() {
		return block;
	}

	public Node getTimes() {
		return times;
	}

	@Override
	protected StitchCounts deriveCounts() {
		Integer n = natural(times);
		StitchCounts c = countsOf(block);
		if (n == null || c == null) {
			return null;
		}
		return c.times(n);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(block, times);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		FixedBlockRepeat other = (FixedBlockRepeat) obj;
		return Objects.equals(block, other.block) && Objects.equals(times, other.times);
	}
}
