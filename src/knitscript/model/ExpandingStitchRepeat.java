package knitscript.model;

import knitscript.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A sequence of stitches worked as many times as the row allows, stopping {@code toLast}
 * stitches before the end of the row.
 *
 * How many times that is depends on the stitches available when the repeat is reached, so the
 * repetition count stays null until count inference resolves it.
 */
public class ExpandingStitchRepeat extends Knittable {
	private final List<Node> stitches;
	private final Node toLast;
	private final Integer times;

	public ExpandingStitchRepeat(SourceLocation location, List<Node> stitches, Node toLast) {
		this(location, stitches, toLast, null);
	}

	public ExpandingStitchRepeat(SourceLocation location, List<Node> stitches, Node toLast, Integer times) {
		super(location);
		this.stitches = Collections.unmodifiableList(stitches);
		this.toLast = toLast;
		this.times = times;
	}

	public List<Node> getStitches() {
		return stitches;
	}

	public Node getToLast() {
		return toLast;
	}

	/**
	 * @return the inferred repetition count, or null before count inference
	 */
	public Integer getTimes() {
		return times;
	}

	public ExpandingStitchRepeat withStitches(List<Node> newStitches) {
		return new ExpandingStitchRepeat(getLocation(), newStitches, toLast, times);
	}

	public ExpandingStitchRepeat withToLast(Node newToLast) {
		return new ExpandingStitchRepeat(getLocation(), stitches, newToLast, times);
	}

	public ExpandingStitchRepeat withTimes(Integer newTimes) {
		return new ExpandingStitchRepeat(getLocation(), stitches, toLast, newTimes);
	}

	/**
	 * @return the counts of one repetition, or null if unknown
	 */
	public StitchCounts getUnitCounts() {
		return sum(stitches);
	}

	@Override
	protected StitchCounts deriveCounts() {
		StitchCounts unit = getUnitCounts();
		if (times == null || unit == null) {
			return null;
		}
		return unit.times(times);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(stitches, toLast, times);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		ExpandingStitchRepeat other = (ExpandingStitchRepeat) obj;
		return stitches.equals(other.stitches) && Objects.equals(toLast, other.toLast) &&
				Objects.equals(times, other.times);
	}
}
