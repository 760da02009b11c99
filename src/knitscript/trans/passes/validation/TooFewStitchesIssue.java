package knitscript.trans.passes.validation;

import knitscript.errors.IssueVisitor;
import knitscript.model.Node;

public class TooFewStitchesIssue extends VerificationIssue {

	private final int expected;
	private final int available;

	public TooFewStitchesIssue(Node node, int expected, int available) {
		super(node);
		this.expected = expected;
		this.available = available;
	}

	public int getExpected() {
		return expected;
	}

	public int getAvailable() {
		return available;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
