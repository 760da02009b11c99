package knitscript.trans.passes.validation;

import knitscript.errors.IssueVisitor;
import knitscript.model.Node;

public class LeftoverStitchesIssue extends VerificationIssue {

	private final int leftover;

	public LeftoverStitchesIssue(Node node, int leftover) {
		super(node);
		this.leftover = leftover;
	}

	public int getLeftover() {
		return leftover;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
