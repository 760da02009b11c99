package knitscript.trans;

import knitscript.errors.Issue;
import knitscript.errors.IssueVisitor;
import knitscript.model.Node;

public class ArgumentTypeIssue extends Issue {

	private final String functionName;
	private final int position;
	private final String expected;
	private final Node actual;

	public ArgumentTypeIssue(String functionName, int position, String expected, Node actual) {
		this.functionName = functionName;
		this.position = position;
		this.expected = expected;
		this.actual = actual;
	}

	public String getFunctionName() {
		return functionName;
	}

	/**
	 * @return the index of the offending argument, counting from 0
	 */
	public int getPosition() {
		return position;
	}

	public String getExpected() {
		return expected;
	}

	public Node getActual() {
		return actual;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
