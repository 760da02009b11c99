package knitscript.modules;

import knitscript.errors.Issue;
import knitscript.errors.IssueVisitor;

import java.util.Collections;
import java.util.List;

public class CircularModuleReferenceIssue extends Issue {

	private final List<String> chain;

	/**
	 * @param chain the modules involved, in the order they were loaded, ending with the module
	 *              that was already being loaded
	 */
	public CircularModuleReferenceIssue(List<String> chain) {
		this.chain = Collections.unmodifiableList(chain);
	}

	public List<String> getChain() {
		return chain;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
