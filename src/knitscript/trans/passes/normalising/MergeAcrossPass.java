package knitscript.trans.passes.normalising;

import knitscript.InternalCompilerError;
import knitscript.model.*;
import knitscript.trans.passes.inference.RowCounter;
import knitscript.trans.passes.inference.SideInferencePass;
import knitscript.trans.passes.reversal.ReversalPass;
import knitscript.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Composes side-by-side siblings into one sequence of rows, where every row is the horizontal
 * union of the siblings' rows at the same height.
 */
public class MergeAcrossPass {

	private MergeAcrossPass() {}

	/**
	 * Merges flattened, counted siblings. Patterns merge into a pattern, row repeats into a row
	 * repeat, and rows into a row.
	 */
	public static Node perform(List<Node> siblings) {
		if (siblings.isEmpty()) {
			throw new InternalCompilerError("nothing to merge");
		}
		if (!sameKind(siblings)) {
			return mergeUnrolled(siblings);
		}
		Node first = siblings.get(0);
		if (first instanceof Pattern) {
			List<Node> reps = new ArrayList<>();
			for (Node sibling : siblings) {
				reps.add(((Pattern) sibling).toRowRepeat());
			}
			RowRepeat merged = mergeRowRepeats(reps);
			List<Node> rows = FlattenVisitor.natural(merged.getTimes()) == 1 ?
					merged.getRows() : Collections.singletonList(merged);
			// calls have all been substituted by now, so the composed pattern takes no parameters
			return new Pattern(merged.getLocation(), rows, Collections.emptyList(), null);
		} else if (first instanceof RowRepeat) {
			return mergeRowRepeats(siblings);
		} else if (first instanceof Row) {
			List<Row> rows = new ArrayList<>();
			for (Node sibling : siblings) {
				rows.add((Row) sibling);
			}
			return mergeRows(rows);
		}
		throw new InternalCompilerError("cannot merge " + first);
	}

	private static boolean sameKind(List<Node> nodes) {
		for (Node node : nodes) {
			if (node.getClass() != nodes.get(0).getClass()) {
				return false;
			}
		}
		return true;
	}

	private static SourceLocation combinedLocation(List<? extends Node> nodes) {
		SourceLocation location = SourceLocation.unknown();
		for (Node node : nodes) {
			location = location.combine(node.getLocation());
		}
		return location;
	}

	private static List<Node> rowsOf(Node node) {
		if (node instanceof RowRepeat) {
			return ((RowRepeat) node).getRows();
		} else if (node instanceof Pattern) {
			return ((Pattern) node).getRows();
		}
		throw new InternalCompilerError("expected rows, found " + node);
	}

	private static RowRepeat mergeRowRepeats(List<Node> reps) {
		List<List<Node>> rowLists = new ArrayList<>();
		for (Node rep : reps) {
			rowLists.add(rowsOf(rep));
		}
		for (List<Node> group : paddedZip(rowLists)) {
			if (!sameKind(group)) {
				// a row next to a row repeat: unroll everything rather than guess an alignment
				return mergeUnrolled(reps);
			}
		}

		int period = 1;
		for (List<Node> rows : rowLists) {
			int perIteration = countRows(rows);
			if (perIteration > 0) {
				period = lcm(period, perIteration);
			}
		}
		List<List<Node>> expanded = new ArrayList<>();
		int longest = 0;
		for (Node rep : reps) {
			RowRepeat rowRepeat = (RowRepeat) rep;
			int perIteration = countRows(rowRepeat.getRows());
			int times = FlattenVisitor.natural(rowRepeat.getTimes());
			// never repeat a sibling more often than it says
			int expandTimes = perIteration == 0 ? 0 : Math.min(times, period / perIteration);
			expanded.add(repeatRows(rowRepeat.getRows(), expandTimes));
			longest = Math.max(longest, perIteration * times);
		}

		List<Node> merged = new ArrayList<>();
		for (List<Node> group : paddedZip(expanded)) {
			merged.add(perform(group));
		}
		SourceLocation location = combinedLocation(reps);
		int times = (longest + period - 1) / period;
		return new RowRepeat(location, merged, new NaturalLit(SourceLocation.unknown(), times));
	}

	private static RowRepeat mergeUnrolled(List<Node> siblings) {
		List<List<Node>> rowLists = new ArrayList<>();
		for (Node sibling : siblings) {
			rowLists.add(unrollFully(sibling));
		}
		List<Node> merged = new ArrayList<>();
		for (List<Node> group : paddedZip(rowLists)) {
			merged.add(perform(group));
		}
		return new RowRepeat(combinedLocation(siblings), merged, new NaturalLit(SourceLocation.unknown(), 1));
	}

	private static List<Node> unrollFully(Node node) {
		if (node instanceof Row) {
			return Collections.singletonList(node);
		}
		Node flattened = FlattenPass.perform(node, true);
		if (flattened instanceof RowRepeat) {
			RowRepeat rowRepeat = (RowRepeat) flattened;
			return repeatRows(rowRepeat.getRows(), FlattenVisitor.natural(rowRepeat.getTimes()));
		}
		return rowsOf(flattened);
	}

	private static Row mergeRows(List<Row> rows) {
		Side side = rows.get(0).getSide();
		List<Row> ordered = new ArrayList<>(rows);
		if (side == Side.RIGHT) {
			// right side rows are worked right to left
			Collections.reverse(ordered);
		}
		for (int i = 0; i < ordered.size(); i++) {
			Row row = ordered.get(i);
			if (row.getSide() != side) {
				ordered.set(i, (Row) ReversalPass.perform(row, 0));
			}
		}

		List<Node> stitches = new ArrayList<>();
		for (int i = 0; i < ordered.size(); i++) {
			int after = 0;
			for (Row later : ordered.subList(i + 1, ordered.size())) {
				after += later.getConsumes();
			}
			for (Node stitch : ordered.get(i).getStitches()) {
				stitches.add(reserveAfter(stitch, after));
			}
		}
		return new Row(combinedLocation(rows), stitches, side, ordered.get(0).isInferred());
	}

	/**
	 * Expanding repeats have to stop short of the stitches that now belong to siblings further
	 * along the row.
	 */
	private static Node reserveAfter(Node node, int after) {
		if (after == 0) {
			return node;
		}
		if (node instanceof ExpandingStitchRepeat) {
			ExpandingStitchRepeat expanding = (ExpandingStitchRepeat) node;
			ExpandingStitchRepeat nested = expanding.withStitches(
					AstTools.mapAll(expanding.getStitches(), child -> reserveAfter(child, after)));
			return nested.withToLast(new NaturalLit(expanding.getToLast().getLocation(),
					FlattenVisitor.natural(expanding.getToLast()) + after));
		} else if (node instanceof FixedStitchRepeat) {
			FixedStitchRepeat fixed = (FixedStitchRepeat) node;
			return fixed.withStitches(AstTools.mapAll(fixed.getStitches(), child -> reserveAfter(child, after)));
		}
		return node;
	}

	private static List<List<Node>> paddedZip(List<List<Node>> lists) {
		int length = 0;
		for (List<Node> list : lists) {
			length = Math.max(length, list.size());
		}
		List<List<Node>> result = new ArrayList<>(length);
		for (int i = 0; i < length; i++) {
			List<Node> group = new ArrayList<>(lists.size());
			for (List<Node> list : lists) {
				group.add(i < list.size() ? list.get(i) : emptyRow());
			}
			result.add(group);
		}
		return result;
	}

	private static Row emptyRow() {
		return new Row(SourceLocation.unknown(), Collections.emptyList(), Side.RIGHT, false);
	}

	private static int countRows(List<Node> rows) {
		int total = 0;
		for (Node row : rows) {
			total += RowCounter.count(row);
		}
		return total;
	}

	private static int lcm(int a, int b) {
		return a / gcd(a, b) * b;
	}

	private static int gcd(int a, int b) {
		while (b != 0) {
			int t = a % b;
			a = b;
			b = t;
		}
		return a;
	}

	/**
	 * Writes out {@code times} copies of a sequence of rows. When the sequence has an odd number
	 * of rows, each copy starts on the opposite side of the one before, so inferred sides are
	 * inferred again for every copy.
	 */
	public static List<Node> repeatRows(List<Node> rows, int times) {
		List<Node> result = new ArrayList<>();
		if (rows.isEmpty()) {
			return result;
		}
		Side side = startingSide(rows.get(0));
		List<Node> current = rows;
		for (int i = 0; i < times; i++) {
			result.addAll(current);
			if (rows.size() % 2 != 0) {
				side = side.flip();
				List<Node> next = new ArrayList<>(rows.size());
				Iterator<Side> sides = side.alternate();
				for (Node row : rows) {
					next.add(SideInferencePass.perform(row, sides.next()));
				}
				current = next;
			}
		}
		return result;
	}

	static Side startingSide(Node node) {
		if (node instanceof Row) {
			Side side = ((Row) node).getSide();
			return side == null ? Side.RIGHT : side;
		}
		List<Node> rows = rowsOf(node);
		return rows.isEmpty() ? Side.RIGHT : startingSide(rows.get(0));
	}

	/**
	 * Repeats every row of a flattened pattern horizontally.
	 */
	public static Node repeatAcross(Node node, int times) {
		if (node instanceof Row) {
			Row row = (Row) node;
			FixedStitchRepeat repeated = new FixedStitchRepeat(row.getLocation(), row.getStitches(),
					new NaturalLit(SourceLocation.unknown(), times));
			return row.withStitches(Collections.singletonList(repeated));
		} else if (node instanceof RowRepeat) {
			RowRepeat rowRepeat = (RowRepeat) node;
			return rowRepeat.withRows(AstTools.mapAll(rowRepeat.getRows(), row -> repeatAcross(row, times)));
		} else if (node instanceof Pattern) {
			Pattern pattern = (Pattern) node;
			return pattern.withRows(AstTools.mapAll(pattern.getRows(), row -> repeatAcross(row, times)));
		}
		throw new InternalCompilerError("cannot repeat " + node + " across");
	}

}
