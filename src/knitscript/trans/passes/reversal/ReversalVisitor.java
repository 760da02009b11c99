package knitscript.trans.passes.reversal;

import knitscript.InternalCompilerError;
import knitscript.model.*;

import java.util.ArrayList;
import java.util.List;

public class ReversalVisitor extends NodeVisitor<Node, RuntimeException> {

	private final int before;

	public ReversalVisitor(int before) {
		this.before = before;
	}

	/**
	 * Reverses the order of a stitch sequence. Every element is reversed relative to the number of
	 * stitches that preceded it in the original order.
	 */
	private List<Node> reverseSequence(List<Node> stitches) {
		List<Integer> befores = new ArrayList<>(stitches.size());
		int acc = before;
		for (Node stitch : stitches) {
			befores.add(acc);
			acc += ((Knittable) stitch).getConsumes();
		}
		List<Node> result = new ArrayList<>(stitches.size());
		for (int i = stitches.size() - 1; i >= 0; i--) {
			result.add(stitches.get(i).accept(new ReversalVisitor(befores.get(i))));
		}
		return result;
	}

	@Override
	public Node visit(StitchLit stitchLit) {
		return stitchLit.getStitch().getReverse()
				.map(reverse -> (Node) new StitchLit(stitchLit.getLocation(), reverse))
				.orElseThrow(() -> new IrreversibleStitchIssue(stitchLit));
	}

	@Override
	public Node visit(FixedStitchRepeat fixedStitchRepeat) {
		return fixedStitchRepeat.withStitches(reverseSequence(fixedStitchRepeat.getStitches()));
	}

	@Override
	public Node visit(ExpandingStitchRepeat expandingStitchRepeat) {
		// the stitches before the repeat are the ones left after it once the row is turned
		return expandingStitchRepeat
				.withStitches(reverseSequence(expandingStitchRepeat.getStitches()))
				.withToLast(new NaturalLit(expandingStitchRepeat.getToLast().getLocation(), before));
	}

	@Override
	public Node visit(Row row) {
		return new Row(row.getLocation(), reverseSequence(row.getStitches()),
				row.getSide() == null ? null : row.getSide().flip(), row.isInferred());
	}

	@Override
	public Node visit(RowRepeat rowRepeat) {
		throw new InternalCompilerError("cannot reverse a row repeat: " + rowRepeat);
	}

	@Override
	public Node visit(Pattern pattern) {
		throw new InternalCompilerError("cannot reverse a pattern: " + pattern);
	}

	@Override
	public Node visit(Block block) {
		throw new InternalCompilerError("cannot reverse a block: " + block);
	}

	@Override
	public Node visit(FixedBlockRepeat fixedBlockRepeat) {
		throw new InternalCompilerError("cannot reverse a block repeat: " + fixedBlockRepeat);
	}

	@Override
	public Node visit(NaturalLit naturalLit) {
		throw new InternalCompilerError("cannot reverse " + naturalLit);
	}

	@Override
	public Node visit(StringLit stringLit) {
		throw new InternalCompilerError("cannot reverse " + stringLit);
	}

	@Override
	public Node visit(VarRef varRef) {
		throw new InternalCompilerError("unsubstituted name reached reversal: " + varRef);
	}

	@Override
	public Node visit(Call call) {
		throw new InternalCompilerError("unsubstituted call reached reversal: " + call);
	}

	@Override
	public Node visit(NativeFunction nativeFunction) {
		throw new InternalCompilerError("cannot reverse " + nativeFunction);
	}
}
