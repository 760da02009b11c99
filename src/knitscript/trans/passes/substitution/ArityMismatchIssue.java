package knitscript.trans.passes.substitution;

import knitscript.errors.Issue;
import knitscript.errors.IssueVisitor;
import knitscript.model.Call;

public class ArityMismatchIssue extends Issue {

	private final Call call;
	private final String calleeName;
	private final int minExpected;
	private final int maxExpected;

	public ArityMismatchIssue(Call call, String calleeName, int minExpected, int maxExpected) {
		this.call = call;
		this.calleeName = calleeName;
		this.minExpected = minExpected;
		this.maxExpected = maxExpected;
	}

	public Call getCall() {
		return call;
	}

	/**
	 * @return the name of the pattern or function called, or null for an anonymous pattern
	 */
	public String getCalleeName() {
		return calleeName;
	}

	public int getMinExpected() {
		return minExpected;
	}

	public int getMaxExpected() {
		return maxExpected;
	}

	public int getActual() {
		return call.getArgs().size();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
