package knitscript.trans.passes.validation;

import knitscript.errors.Issue;
import knitscript.model.Node;

/**
 * A reason a prepared pattern cannot be knitted as written. These are collected rather than
 * thrown, so a single run reports all of them.
 */
public abstract class VerificationIssue extends Issue {

	private final Node node;

	public VerificationIssue(Node node) {
		this.node = node;
	}

	/**
	 * @return the node the problem was found at
	 */
	public Node getNode() {
		return node;
	}

}
