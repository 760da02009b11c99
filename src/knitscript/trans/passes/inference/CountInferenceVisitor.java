package knitscript.trans.passes.inference;

import knitscript.InternalCompilerError;
import knitscript.model.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Threads the number of available stitches through an expression, resolving expanding repeats
 * on the way.
 *
 * Inference is best effort: an expanding repeat that does not divide its row evenly still gets
 * the rounded-down count, and the verifier reports the remainder.
 */
public class CountInferenceVisitor extends NodeVisitor<Node, RuntimeException> {

	private final Integer available;

	public CountInferenceVisitor(Integer available) {
		this.available = available;
	}

	private static int natural(Node node) {
		if (!(node instanceof NaturalLit)) {
			throw new InternalCompilerError("expected a natural number, found " + node);
		}
		return ((NaturalLit) node).getValue();
	}

	private static List<Node> inferSequence(List<Node> stitches, Integer available) {
		List<Node> counted = new ArrayList<>(stitches.size());
		Integer remaining = available;
		for (Node stitch : stitches) {
			Node c = stitch.accept(new CountInferenceVisitor(remaining));
			counted.add(c);
			if (remaining != null && c instanceof Knittable && ((Knittable) c).hasCounts()) {
				remaining -= ((Knittable) c).getConsumes();
			} else {
				remaining = null;
			}
		}
		return counted;
	}

	private static List<Node> inferRows(List<Node> rows, int times, Integer available) {
		List<Node> counted = new ArrayList<>(rows.size());
		Integer current = available;
		for (int i = 0; i < Math.max(1, times); i++) {
			for (Node row : rows) {
				Node c = row.accept(new CountInferenceVisitor(current));
				if (c instanceof Knittable && ((Knittable) c).hasCounts()) {
					current = ((Knittable) c).getProduces();
				} else {
					current = null;
				}
				if (counted.size() < rows.size()) {
					counted.add(c);
				}
			}
		}
		return counted;
	}

	@Override
	public Node visit(NaturalLit naturalLit) {
		return naturalLit;
	}

	@Override
	public Node visit(StringLit stringLit) {
		return stringLit;
	}

	@Override
	public Node visit(StitchLit stitchLit) {
		return stitchLit;
	}

	@Override
	public Node visit(FixedStitchRepeat fixedStitchRepeat) {
		return fixedStitchRepeat.withStitches(inferSequence(fixedStitchRepeat.getStitches(), available));
	}

	@Override
	public Node visit(ExpandingStitchRepeat expandingStitchRepeat) {
		if (available == null) {
			throw new AmbiguousRepeatIssue(expandingStitchRepeat);
		}
		int budget = available - natural(expandingStitchRepeat.getToLast());
		ExpandingStitchRepeat unit = expandingStitchRepeat.withStitches(
				inferSequence(expandingStitchRepeat.getStitches(), budget));
		StitchCounts unitCounts = unit.getUnitCounts();
		if (unitCounts == null || unitCounts.getConsumes() <= 0) {
			throw new AmbiguousRepeatIssue(expandingStitchRepeat);
		}
		return unit.withTimes(Math.max(0, Math.floorDiv(budget, unitCounts.getConsumes())));
	}

	@Override
	public Node visit(Row row) {
		return row.withStitches(inferSequence(row.getStitches(), available));
	}

	@Override
	public Node visit(RowRepeat rowRepeat) {
		return rowRepeat.withRows(inferRows(rowRepeat.getRows(), natural(rowRepeat.getTimes()), available));
	}

	@Override
	public Node visit(Pattern pattern) {
		return pattern.withRows(inferRows(pattern.getRows(), 1, available));
	}

	@Override
	public Node visit(Block block) {
		List<Node> patterns = block.getPatterns();
		if (patterns.size() == 1) {
			return block.withPatterns(Collections.singletonList(patterns.get(0).accept(this)));
		}
		// siblings work disjoint stitches, so none of them can use the row's budget
		return block.withPatterns(AstTools.mapAll(patterns, p -> p.accept(new CountInferenceVisitor(null))));
	}

	@Override
	public Node visit(FixedBlockRepeat fixedBlockRepeat) {
		return new FixedBlockRepeat(fixedBlockRepeat.getLocation(), fixedBlockRepeat.getBlock().accept(this),
				fixedBlockRepeat.getTimes());
	}

	@Override
	public Node visit(VarRef varRef) {
		throw new InternalCompilerError("unsubstituted name reached count inference: " + varRef);
	}

	@Override
	public Node visit(Call call) {
		throw new InternalCompilerError("unsubstituted call reached count inference: " + call);
	}

	@Override
	public Node visit(NativeFunction nativeFunction) {
		throw new InternalCompilerError("function value reached count inference: " + nativeFunction);
	}
}
