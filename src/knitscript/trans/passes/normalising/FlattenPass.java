package knitscript.trans.passes.normalising;

import knitscript.model.Node;

public class FlattenPass {

	private FlattenPass() {}

	/**
	 * Removes redundant nesting: merges nested fixed repeats, splices nested patterns and
	 * once-only row repeats into their parent, and composes blocks into single patterns.
	 *
	 * @param unroll whether every nested row repeat should be unrolled into literal rows
	 */
	public static Node perform(Node node, boolean unroll) {
		return node.accept(new FlattenVisitor(unroll));
	}

	public static Node perform(Node node) {
		return perform(node, false);
	}

}
