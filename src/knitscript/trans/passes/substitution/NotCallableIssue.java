package knitscript.trans.passes.substitution;

import knitscript.errors.Issue;
import knitscript.errors.IssueVisitor;
import knitscript.model.Call;
import knitscript.model.Node;

public class NotCallableIssue extends Issue {

	private final Call call;
	private final Node target;

	public NotCallableIssue(Call call, Node target) {
		this.call = call;
		this.target = target;
	}

	public Call getCall() {
		return call;
	}

	public Node getTarget() {
		return target;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
