package knitscript.errors;

/**
 * An issue together with what was going on when it was raised: the pattern call being expanded or
 * the module being loaded. Layers nest from the outermost context inwards.
 */
public class IssueWithContext extends Issue {
	private final Issue issue;
	private final Context context;

	public IssueWithContext(Issue issue, Context context) {
		this.issue = issue;
		this.context = context;
	}

	public Issue getIssue() {
		return issue;
	}

	public Context getContext() {
		return context;
	}

	@Override
	public Issue getRootIssue() {
		return issue.getRootIssue();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
