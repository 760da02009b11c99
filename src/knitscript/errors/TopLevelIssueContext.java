package knitscript.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects reported issues in the order they were found.
 */
public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> issues = new ArrayList<>();

	@Override
	public void error(Issue err) {
		issues.add(err);
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

}
