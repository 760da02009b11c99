package knitscript.trans.passes.inference;

import knitscript.InternalCompilerError;
import knitscript.model.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

public class SideInferenceVisitor extends NodeVisitor<Node, RuntimeException> {

	private final Side side;

	public SideInferenceVisitor(Side side) {
		this.side = side;
	}

	private static List<Node> alternate(List<Node> rows, Side start) {
		List<Node> result = new ArrayList<>(rows.size());
		Iterator<Side> sides = start.alternate();
		for (Node row : rows) {
			result.add(row.accept(new SideInferenceVisitor(sides.next())));
		}
		return result;
	}

	@Override
	public Node visit(Row row) {
		if (row.getSide() == null || row.isInferred()) {
			return row.withSide(side, true);
		}
		return row;
	}

	@Override
	public Node visit(RowRepeat rowRepeat) {
		return rowRepeat.withRows(alternate(rowRepeat.getRows(), side));
	}

	@Override
	public Node visit(Pattern pattern) {
		return pattern.withRows(alternate(pattern.getRows(), SideInferencePass.startingSide(pattern)));
	}

	@Override
	public Node visit(Block block) {
		// siblings share their rows, so they all start on the same side
		return block.withPatterns(AstTools.mapAll(block.getPatterns(), p -> p.accept(this)));
	}

	@Override
	public Node visit(FixedBlockRepeat fixedBlockRepeat) {
		return new FixedBlockRepeat(fixedBlockRepeat.getLocation(), fixedBlockRepeat.getBlock().accept(this),
				fixedBlockRepeat.getTimes());
	}

	@Override
	public Node visit(NaturalLit naturalLit) {
		throw new InternalCompilerError("expected rows, found " + naturalLit);
	}

	@Override
	public Node visit(StringLit stringLit) {
		throw new InternalCompilerError("expected rows, found " + stringLit);
	}

	@Override
	public Node visit(StitchLit stitchLit) {
		throw new InternalCompilerError("expected rows, found " + stitchLit);
	}

	@Override
	public Node visit(FixedStitchRepeat fixedStitchRepeat) {
		throw new InternalCompilerError("expected rows, found " + fixedStitchRepeat);
	}

	@Override
	public Node visit(ExpandingStitchRepeat expandingStitchRepeat) {
		throw new InternalCompilerError("expected rows, found " + expandingStitchRepeat);
	}

	@Override
	public Node visit(VarRef varRef) {
		throw new InternalCompilerError("unsubstituted name reached side inference: " + varRef);
	}

	@Override
	public Node visit(Call call) {
		throw new InternalCompilerError("unsubstituted call reached side inference: " + call);
	}

	@Override
	public Node visit(NativeFunction nativeFunction) {
		throw new InternalCompilerError("expected rows, found " + nativeFunction);
	}
}
