package knitscript.trans.passes.reversal;

import knitscript.model.Node;
import knitscript.model.Side;

public class AlternationPass {

	private AlternationPass() {}

	/**
	 * Makes rows strictly alternate sides starting from {@code side}, reversing every row that
	 * is on the wrong one.
	 */
	public static Node perform(Node node, Side side) {
		return node.accept(new AlternationVisitor(side));
	}

}
