package knitscript.trans.passes.substitution;

import knitscript.errors.Issue;
import knitscript.errors.IssueVisitor;
import knitscript.model.VarRef;

public class UnboundNameIssue extends Issue {

	private final VarRef ref;

	public UnboundNameIssue(VarRef ref) {
		this.ref = ref;
	}

	public VarRef getRef() {
		return ref;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
