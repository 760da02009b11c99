package knitscript.trans.passes.inference;

import knitscript.model.AstTools;
import knitscript.model.Node;
import knitscript.model.Pattern;
import knitscript.model.RowRepeat;
import knitscript.model.Side;
import knitscript.model.Stitch;
import knitscript.model.StitchLit;

public class SideInferencePass {

	private SideInferencePass() {}

	/**
	 * Gives every row without an explicit side an inferred one, alternating from {@code side}.
	 * Patterns pick their own starting side.
	 */
	public static Node perform(Node node, Side side) {
		return node.accept(new SideInferenceVisitor(side));
	}

	/**
	 * A pattern that starts with a row of nothing but cast-ons starts on the wrong side, since
	 * casting on counts as the setup row.
	 */
	public static Side startingSide(Pattern pattern) {
		return startsWithCastOns(pattern, true) ? Side.WRONG : Side.RIGHT;
	}

	static boolean startsWithCastOns(Node node, boolean acc) {
		if (node instanceof StitchLit) {
			return acc && ((StitchLit) node).getStitch() == Stitch.CAST_ON;
		}
		if (node instanceof Pattern) {
			Pattern pattern = (Pattern) node;
			return !pattern.getRows().isEmpty() && startsWithCastOns(pattern.getRows().get(0), acc);
		}
		if (node instanceof RowRepeat) {
			RowRepeat rowRepeat = (RowRepeat) node;
			return !rowRepeat.getRows().isEmpty() && startsWithCastOns(rowRepeat.getRows().get(0), acc);
		}
		return AstTools.fold(node, SideInferencePass::startsWithCastOns, acc);
	}

}
