package knitscript.trans.passes.normalising;

import knitscript.InternalCompilerError;
import knitscript.model.*;

import java.util.ArrayList;
import java.util.List;

public class FlattenVisitor extends NodeVisitor<Node, RuntimeException> {

	private final boolean unroll;

	public FlattenVisitor(boolean unroll) {
		this.unroll = unroll;
	}

	static int natural(Node node) {
		if (!(node instanceof NaturalLit)) {
			throw new InternalCompilerError("expected a natural number, found " + node);
		}
		return ((NaturalLit) node).getValue();
	}

	private List<Node> flattenStitches(List<Node> stitches) {
		List<Node> result = new ArrayList<>();
		for (Node stitch : stitches) {
			Node flattened = stitch.accept(this);
			if (flattened instanceof FixedStitchRepeat && natural(((FixedStitchRepeat) flattened).getTimes()) == 1) {
				result.addAll(((FixedStitchRepeat) flattened).getStitches());
			} else {
				result.add(flattened);
			}
		}
		return result;
	}

	private List<Node> flattenRows(List<Node> rows) {
		List<Node> result = new ArrayList<>();
		for (Node row : rows) {
			Node flattened = row.accept(this);
			if (flattened instanceof RowRepeat) {
				RowRepeat rowRepeat = (RowRepeat) flattened;
				int times = natural(rowRepeat.getTimes());
				if (unroll || times <= 1) {
					result.addAll(MergeAcrossPass.repeatRows(rowRepeat.getRows(), times));
				} else {
					result.add(flattened);
				}
			} else if (flattened instanceof Pattern) {
				result.addAll(((Pattern) flattened).getRows());
			} else {
				result.add(flattened);
			}
		}
		return result;
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
		int times = natural(fixedStitchRepeat.getTimes());
		List<Node> stitches = flattenStitches(fixedStitchRepeat.getStitches());
		if (times != 1 && stitches.size() == 1 && stitches.get(0) instanceof FixedStitchRepeat) {
			// [[K, P] 2] 3 reads better as [K, P] 6
			FixedStitchRepeat inner = (FixedStitchRepeat) stitches.get(0);
			FixedStitchRepeat merged = new FixedStitchRepeat(
					fixedStitchRepeat.getLocation(),
					inner.getStitches(),
					new NaturalLit(fixedStitchRepeat.getTimes().getLocation(), natural(inner.getTimes()) * times));
			return merged.accept(this);
		}
		return fixedStitchRepeat.withStitches(stitches);
	}

	@Override
	public Node visit(ExpandingStitchRepeat expandingStitchRepeat) {
		return expandingStitchRepeat.withStitches(flattenStitches(expandingStitchRepeat.getStitches()));
	}

	@Override
	public Node visit(Row row) {
		return row.withStitches(flattenStitches(row.getStitches()));
	}

	@Override
	public Node visit(RowRepeat rowRepeat) {
		return rowRepeat.withRows(flattenRows(rowRepeat.getRows()));
	}

	@Override
	public Node visit(Pattern pattern) {
		return pattern.withRows(flattenRows(pattern.getRows()));
	}

	@Override
	public Node visit(Block block) {
		// unrolled, so that a row next to a row repeat cannot throw the siblings out of step
		FlattenVisitor unrolling = new FlattenVisitor(true);
		List<Node> siblings = AstTools.mapAll(block.getPatterns(), p -> p.accept(unrolling));
		return MergeAcrossPass.perform(siblings).accept(this);
	}

	@Override
	public Node visit(FixedBlockRepeat fixedBlockRepeat) {
		Node flattened = fixedBlockRepeat.getBlock().accept(this);
		return MergeAcrossPass.repeatAcross(flattened, natural(fixedBlockRepeat.getTimes())).accept(this);
	}

	@Override
	public Node visit(VarRef varRef) {
		throw new InternalCompilerError("unsubstituted name reached flattening: " + varRef);
	}

	@Override
	public Node visit(Call call) {
		throw new InternalCompilerError("unsubstituted call reached flattening: " + call);
	}

	@Override
	public Node visit(NativeFunction nativeFunction) {
		throw new InternalCompilerError("function value reached flattening: " + nativeFunction);
	}
}
