package knitscript.trans.passes.normalising;

import knitscript.model.*;
import knitscript.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class StitchCombiningVisitor extends NodeVisitor<Node, RuntimeException> {

	private static Stitch stitchOf(Node node) {
		if (node instanceof StitchLit) {
			return ((StitchLit) node).getStitch();
		}
		if (node instanceof FixedStitchRepeat) {
			FixedStitchRepeat fixed = (FixedStitchRepeat) node;
			if (fixed.getStitches().size() == 1 && fixed.getStitches().get(0) instanceof StitchLit &&
					fixed.getTimes() instanceof NaturalLit) {
				return ((StitchLit) fixed.getStitches().get(0)).getStitch();
			}
		}
		return null;
	}

	private static int timesOf(Node node) {
		if (node instanceof StitchLit) {
			return 1;
		}
		return ((NaturalLit) ((FixedStitchRepeat) node).getTimes()).getValue();
	}

	private List<Node> combine(List<Node> stitches) {
		List<Node> result = new ArrayList<>();
		for (Node stitch : stitches) {
			Node current = stitch.accept(this);
			if (!result.isEmpty()) {
				Node last = result.get(result.size() - 1);
				Stitch kind = stitchOf(current);
				if (kind != null && kind == stitchOf(last)) {
					SourceLocation location = last.getLocation().combine(current.getLocation());
					result.set(result.size() - 1, new FixedStitchRepeat(
							location,
							Collections.singletonList(new StitchLit(location, kind)),
							new NaturalLit(SourceLocation.unknown(), timesOf(last) + timesOf(current))));
					continue;
				}
			}
			result.add(current);
		}
		return result;
	}

	@Override
	public Node visit(FixedStitchRepeat fixedStitchRepeat) {
		return fixedStitchRepeat.withStitches(combine(fixedStitchRepeat.getStitches()));
	}

	@Override
	public Node visit(ExpandingStitchRepeat expandingStitchRepeat) {
		return expandingStitchRepeat.withStitches(combine(expandingStitchRepeat.getStitches()));
	}

	@Override
	public Node visit(Row row) {
		return row.withStitches(combine(row.getStitches()));
	}

	@Override
	public Node visit(RowRepeat rowRepeat) {
		return AstTools.map(rowRepeat, child -> child.accept(this));
	}

	@Override
	public Node visit(Pattern pattern) {
		return AstTools.map(pattern, child -> child.accept(this));
	}

	@Override
	public Node visit(Block block) {
		return AstTools.map(block, child -> child.accept(this));
	}

	@Override
	public Node visit(FixedBlockRepeat fixedBlockRepeat) {
		return AstTools.map(fixedBlockRepeat, child -> child.accept(this));
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
	public Node visit(VarRef varRef) {
		return varRef;
	}

	@Override
	public Node visit(Call call) {
		return call;
	}

	@Override
	public Node visit(NativeFunction nativeFunction) {
		return nativeFunction;
	}
}
