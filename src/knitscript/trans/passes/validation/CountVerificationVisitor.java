package knitscript.trans.passes.validation;

import knitscript.InternalCompilerError;
import knitscript.errors.IssueContext;
import knitscript.model.*;

import java.util.List;

/**
 * Re-derives stitch counts top-down and reports every place they fail to add up.
 *
 * A shortfall is reported at the innermost node that runs out of stitches, so the row containing
 * it only reports stitches it leaves unworked.
 */
public class CountVerificationVisitor extends NodeVisitor<Void, RuntimeException> {

	private final IssueContext ctx;
	private final int available;

	public CountVerificationVisitor(IssueContext ctx, int available) {
		this.ctx = ctx;
		this.available = available;
	}

	private static int natural(Node node) {
		if (!(node instanceof NaturalLit)) {
			throw new InternalCompilerError("expected a natural number, found " + node);
		}
		return ((NaturalLit) node).getValue();
	}

	private void atLeast(int expected, int actual, Node node) {
		if (expected > actual) {
			ctx.error(new TooFewStitchesIssue(node, expected, actual));
		}
	}

	private void exactly(int expected, int actual, Node node) {
		atLeast(expected, actual, node);
		if (expected < actual) {
			ctx.error(new LeftoverStitchesIssue(node, actual - expected));
		}
	}

	private int verifySequence(List<Node> stitches, int budget) {
		int consumed = 0;
		for (Node stitch : stitches) {
			stitch.accept(new CountVerificationVisitor(ctx, budget - consumed));
			consumed += ((Knittable) stitch).getConsumes();
		}
		return consumed;
	}

	private void verifyRows(List<Node> rows, int times, Node repeat) {
		int current = available;
		for (Node row : rows) {
			row.accept(new CountVerificationVisitor(ctx, current));
			Knittable knittable = (Knittable) row;
			if (row instanceof Row && knittable.getConsumes() < current) {
				ctx.error(new LeftoverStitchesIssue(row, current - knittable.getConsumes()));
			}
			current = knittable.getProduces();
		}
		if (times > 1) {
			// every repetition has to start with the same number of stitches
			exactly(available, current, repeat);
		}
	}

	@Override
	public Void visit(StitchLit stitchLit) {
		atLeast(stitchLit.getConsumes(), available, stitchLit);
		return null;
	}

	@Override
	public Void visit(FixedStitchRepeat fixedStitchRepeat) {
		int consumed = verifySequence(fixedStitchRepeat.getStitches(), available);
		int times = natural(fixedStitchRepeat.getTimes());
		if (times > 1) {
			atLeast(times * consumed, available, fixedStitchRepeat);
		}
		return null;
	}

	@Override
	public Void visit(ExpandingStitchRepeat expandingStitchRepeat) {
		int toLast = natural(expandingStitchRepeat.getToLast());
		int budget = available - toLast;
		if (budget < 0) {
			ctx.error(new TooFewStitchesIssue(expandingStitchRepeat, toLast, available));
			return null;
		}
		int unit = verifySequence(expandingStitchRepeat.getStitches(), budget);
		if (unit <= 0) {
			throw new InternalCompilerError("expanding repeat does not consume stitches: " + expandingStitchRepeat);
		}
		int n = budget / unit;
		exactly(n * unit, budget, expandingStitchRepeat);
		return null;
	}

	@Override
	public Void visit(Row row) {
		verifySequence(row.getStitches(), available);
		return null;
	}

	@Override
	public Void visit(RowRepeat rowRepeat) {
		verifyRows(rowRepeat.getRows(), natural(rowRepeat.getTimes()), rowRepeat);
		return null;
	}

	@Override
	public Void visit(Pattern pattern) {
		verifyRows(pattern.getRows(), 1, pattern);
		return null;
	}

	@Override
	public Void visit(Block block) {
		throw new InternalCompilerError("cannot verify an unflattened block: " + block);
	}

	@Override
	public Void visit(FixedBlockRepeat fixedBlockRepeat) {
		throw new InternalCompilerError("cannot verify an unflattened block repeat: " + fixedBlockRepeat);
	}

	@Override
	public Void visit(NaturalLit naturalLit) {
		throw new InternalCompilerError("cannot verify " + naturalLit);
	}

	@Override
	public Void visit(StringLit stringLit) {
		throw new InternalCompilerError("cannot verify " + stringLit);
	}

	@Override
	public Void visit(VarRef varRef) {
		throw new InternalCompilerError("unsubstituted name reached verification: " + varRef);
	}

	@Override
	public Void visit(Call call) {
		throw new InternalCompilerError("unsubstituted call reached verification: " + call);
	}

	@Override
	public Void visit(NativeFunction nativeFunction) {
		throw new InternalCompilerError("cannot verify " + nativeFunction);
	}
}
