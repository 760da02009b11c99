package knitscript.trans.passes.substitution;

import knitscript.errors.Issue;
import knitscript.errors.IssueVisitor;
import knitscript.model.Call;

/**
 * A call to a function that only has an effect (like {@code show}) was used where a value is
 * needed.
 */
public class VoidCallIssue extends Issue {

	private final Call call;

	public VoidCallIssue(Call call) {
		this.call = call;
	}

	public Call getCall() {
		return call;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
