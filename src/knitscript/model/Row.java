package knitscript.model;

import knitscript.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One physical row of knitting. The side is null until side inference runs, unless the author
 * stated it; {@code inferred} records which of the two it was, since inferred sides may be
 * re-inferred when rows get repeated.
 */
public class Row extends Knittable {
	private final List<Node> stitches;
	private final Side side;
	private final boolean inferred;

	public Row(SourceLocation location, List<Node> stitches, Side side, boolean inferred) {
		super(location);
		this.stitches = Collections.unmodifiableList(stitches);
		this.side = side;
		this.inferred = inferred;
	}

	public List<Node> getStitches() {
		return stitches;
	}

	public Side getSide() {
		return side;
	}

	public boolean isInferred() {
		return inferred;
	}

	public Row withStitches(List<Node> newStitches) {
		return new Row(getLocation(), newStitches, side, inferred);
	}

	public Row withSide(Side newSide, boolean newInferred) {
		return new Row(getLocation(), stitches, newSide, newInferred);
	}

	@Override
	protected StitchCounts deriveCounts() {
		return sum(stitches);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(stitches, side, inferred);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		Row other = (Row) obj;
		return stitches.equals(other.stitches) && side == other.side && inferred == other.inferred;
	}
}
