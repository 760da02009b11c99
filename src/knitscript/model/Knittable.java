package knitscript.model;

import knitscript.InternalCompilerError;
import knitscript.util.SourceLocation;

import java.util.List;

/**
 * A node that stands for knitting work: a stitch, a repeat, a row or a group of rows.
 *
 * Stitch counts are derived from the node's children rather than stored by a pass, so they can
 * never go stale when a pass rebuilds part of a tree. A count is unknown while it depends on an
 * expanding repeat whose repetition count has not been inferred yet, or on an expression that
 * has not been substituted.
 */
public abstract class Knittable extends Node {

	private StitchCounts counts;
	private boolean derived = false;

	public Knittable(SourceLocation location) {
		super(location);
	}

	/**
	 * @return this node's counts, or null if they are not known yet
	 */
	protected abstract StitchCounts deriveCounts();

	public StitchCounts getCounts() {
		if (!derived) {
			counts = deriveCounts();
			derived = true;
		}
		return counts;
	}

	public boolean hasCounts() {
		return getCounts() != null;
	}

	public int getConsumes() {
		return requireCounts().getConsumes();
	}

	public int getProduces() {
		return requireCounts().getProduces();
	}

	private StitchCounts requireCounts() {
		StitchCounts result = getCounts();
		if (result == null) {
			throw new InternalCompilerError("stitch counts are not known for " + this);
		}
		return result;
	}

	static StitchCounts countsOf(Node node) {
		if (node instanceof Knittable) {
			return ((Knittable) node).getCounts();
		}
		return null;
	}

	static StitchCounts sum(List<Node> nodes) {
		StitchCounts total = StitchCounts.ZERO;
		for (Node node : nodes) {
			StitchCounts c = countsOf(node);
			if (c == null) {
				return null;
			}
			total = total.plus(c);
		}
		return total;
	}

	/**
	 * Counts for a vertical sequence of rows: the first row takes from the needle, the last row
	 * leaves its stitches there.
	 */
	static StitchCounts chain(List<Node> rows) {
		if (rows.isEmpty()) {
			return StitchCounts.ZERO;
		}
		StitchCounts first = countsOf(rows.get(0));
		StitchCounts last = countsOf(rows.get(rows.size() - 1));
		if (first == null || last == null) {
			return null;
		}
		return new StitchCounts(first.getConsumes(), last.getProduces());
	}

	static Integer natural(Node node) {
		if (node instanceof NaturalLit) {
			return ((NaturalLit) node).getValue();
		}
		return null;
	}

}
