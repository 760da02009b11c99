package knitscript.trans.passes.validation;

import knitscript.errors.Issue;
import knitscript.errors.IssueContext;
import knitscript.errors.TopLevelIssueContext;
import knitscript.model.Pattern;

import java.util.List;

public class VerificationPass {

	private VerificationPass() {}

	/**
	 * Checks a prepared pattern, reporting every problem found into {@code ctx}: stitch counts that
	 * do not add up, a needle that is not empty at the start or end, and pass-overs without a
	 * slipped stitch to pass.
	 */
	public static void perform(IssueContext ctx, Pattern pattern) {
		pattern.accept(new CountVerificationVisitor(ctx, 0));
		if (pattern.getConsumes() != 0) {
			ctx.error(new TooManyStitchesIssue(pattern, pattern.getConsumes(), TooManyStitchesIssue.Phase.CAST_ON));
		}
		if (pattern.getProduces() != 0) {
			ctx.error(new TooManyStitchesIssue(pattern, pattern.getProduces(), TooManyStitchesIssue.Phase.BIND_OFF));
		}
		pattern.accept(new PassOverVerificationVisitor(ctx));
	}

	public static List<Issue> verify(Pattern pattern) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		perform(ctx, pattern);
		return ctx.getIssues();
	}

}
