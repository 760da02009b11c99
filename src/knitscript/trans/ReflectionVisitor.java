package knitscript.trans;

import knitscript.model.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mirrors an expression horizontally: the stitches of every row are worked in the opposite order.
 * Unlike reversal, the stitches themselves are not changed, so the mirrored rows stay on the same
 * side.
 */
public class ReflectionVisitor extends NodeVisitor<Node, RuntimeException> {

	private List<Node> reflectAll(List<Node> stitches) {
		List<Node> result = new ArrayList<>(AstTools.mapAll(stitches, s -> s.accept(this)));
		Collections.reverse(result);
		return result;
	}

	private Node reflectChildren(Node node) {
		return AstTools.map(node, child -> child.accept(this));
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
		return fixedStitchRepeat.withStitches(reflectAll(fixedStitchRepeat.getStitches()));
	}

	@Override
	public Node visit(ExpandingStitchRepeat expandingStitchRepeat) {
		return expandingStitchRepeat.withStitches(reflectAll(expandingStitchRepeat.getStitches()));
	}

	@Override
	public Node visit(Row row) {
		return row.withStitches(reflectAll(row.getStitches()));
	}

	@Override
	public Node visit(RowRepeat rowRepeat) {
		return reflectChildren(rowRepeat);
	}

	@Override
	public Node visit(Pattern pattern) {
		return reflectChildren(pattern);
	}

	@Override
	public Node visit(Block block) {
		return reflectChildren(block);
	}

	@Override
	public Node visit(FixedBlockRepeat fixedBlockRepeat) {
		return reflectChildren(fixedBlockRepeat);
	}

	@Override
	public Node visit(VarRef varRef) {
		return varRef;
	}

	@Override
	public Node visit(Call call) {
		return reflectChildren(call);
	}

	@Override
	public Node visit(NativeFunction nativeFunction) {
		return nativeFunction;
	}

}
