package knitscript.trans.passes.inference;

import knitscript.InternalCompilerError;
import knitscript.model.*;

/**
 * Counts the physical rows an expression spans, repeats included.
 */
public class RowCounter extends NodeVisitor<Integer, RuntimeException> {

	public static int count(Node node) {
		return node.accept(new RowCounter());
	}

	private static int times(Node times) {
		if (!(times instanceof NaturalLit)) {
			throw new InternalCompilerError("repeat count was not substituted: " + times);
		}
		return ((NaturalLit) times).getValue();
	}

	private int sum(Iterable<Node> rows) {
		int total = 0;
		for (Node row : rows) {
			total += row.accept(this);
		}
		return total;
	}

	@Override
	public Integer visit(Row row) {
		return 1;
	}

	@Override
	public Integer visit(RowRepeat rowRepeat) {
		return sum(rowRepeat.getRows()) * times(rowRepeat.getTimes());
	}

	@Override
	public Integer visit(Pattern pattern) {
		return sum(pattern.getRows());
	}

	@Override
	public Integer visit(Block block) {
		int max = 0;
		for (Node pattern : block.getPatterns()) {
			max = Math.max(max, pattern.accept(this));
		}
		return max;
	}

	@Override
	public Integer visit(FixedBlockRepeat fixedBlockRepeat) {
		return fixedBlockRepeat.getBlock().accept(this);
	}

	@Override
	public Integer visit(NaturalLit naturalLit) {
		throw new InternalCompilerError("cannot count rows of " + naturalLit);
	}

	@Override
	public Integer visit(StringLit stringLit) {
		throw new InternalCompilerError("cannot count rows of " + stringLit);
	}

	@Override
	public Integer visit(StitchLit stitchLit) {
		throw new InternalCompilerError("cannot count rows of " + stitchLit);
	}

	@Override
	public Integer visit(FixedStitchRepeat fixedStitchRepeat) {
		throw new InternalCompilerError("cannot count rows of " + fixedStitchRepeat);
	}

	@Override
	public Integer visit(ExpandingStitchRepeat expandingStitchRepeat) {
		throw new InternalCompilerError("cannot count rows of " + expandingStitchRepeat);
	}

	@Override
	public Integer visit(VarRef varRef) {
		throw new InternalCompilerError("cannot count rows of unsubstituted " + varRef);
	}

	@Override
	public Integer visit(Call call) {
		throw new InternalCompilerError("cannot count rows of unsubstituted " + call);
	}

	@Override
	public Integer visit(NativeFunction nativeFunction) {
		throw new InternalCompilerError("cannot count rows of " + nativeFunction);
	}
}
