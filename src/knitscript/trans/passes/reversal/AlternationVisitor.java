package knitscript.trans.passes.reversal;

import knitscript.InternalCompilerError;
import knitscript.model.*;
import knitscript.trans.passes.inference.RowCounter;

import java.util.ArrayList;
import java.util.List;

public class AlternationVisitor extends NodeVisitor<Node, RuntimeException> {

	private final Side side;

	public AlternationVisitor(Side side) {
		this.side = side;
	}

	private List<Node> alternate(List<Node> rows) {
		List<Node> result = new ArrayList<>(rows.size());
		Side current = side;
		for (Node row : rows) {
			result.add(row.accept(new AlternationVisitor(current)));
			// an even number of rows ends up back on the side it started from
			if (RowCounter.count(row) % 2 != 0) {
				current = current.flip();
			}
		}
		return result;
	}

	@Override
	public Node visit(Row row) {
		if (row.getSide() == side) {
			return row;
		}
		return ReversalPass.perform(row, 0);
	}

	@Override
	public Node visit(RowRepeat rowRepeat) {
		return rowRepeat.withRows(alternate(rowRepeat.getRows()));
	}

	@Override
	public Node visit(Pattern pattern) {
		return pattern.withRows(alternate(pattern.getRows()));
	}

	@Override
	public Node visit(Block block) {
		throw new InternalCompilerError("blocks must be flattened before alternating sides: " + block);
	}

	@Override
	public Node visit(FixedBlockRepeat fixedBlockRepeat) {
		throw new InternalCompilerError(
				"blocks must be flattened before alternating sides: " + fixedBlockRepeat);
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
		throw new InternalCompilerError("unsubstituted name reached side alternation: " + varRef);
	}

	@Override
	public Node visit(Call call) {
		throw new InternalCompilerError("unsubstituted call reached side alternation: " + call);
	}

	@Override
	public Node visit(NativeFunction nativeFunction) {
		throw new InternalCompilerError("expected rows, found " + nativeFunction);
	}
}
