package knitscript.trans.passes.inference;

import knitscript.model.Node;

public class CountInferencePass {

	private CountInferencePass() {}

	/**
	 * Solves the repetition count of every expanding repeat it can reach.
	 *
	 * @param available the number of stitches on the needle before the expression, or null if
	 *                  unknown
	 */
	public static Node perform(Node node, Integer available) {
		return node.accept(new CountInferenceVisitor(available));
	}

}
