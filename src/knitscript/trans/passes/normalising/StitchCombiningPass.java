package knitscript.trans.passes.normalising;

import knitscript.model.Node;

public class StitchCombiningPass {

	private StitchCombiningPass() {}

	/**
	 * Collapses runs of the same stitch into one repeat, so that {@code K, K, K 3} becomes
	 * {@code K 5}.
	 */
	public static Node perform(Node node) {
		return node.accept(new StitchCombiningVisitor());
	}

}
