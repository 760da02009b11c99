package knitscript.trans.passes.reversal;

import knitscript.model.Node;

public class ReversalPass {

	private ReversalPass() {}

	/**
	 * Rewrites a counted row or stitch sequence so that it has the same effect when worked in the
	 * opposite direction.
	 *
	 * @param before the number of stitches worked in the row before this expression
	 */
	public static Node perform(Node node, int before) {
		return node.accept(new ReversalVisitor(before));
	}

}
