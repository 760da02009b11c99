package knitscript.trans.passes.inference;

import knitscript.errors.Issue;
import knitscript.errors.IssueVisitor;
import knitscript.model.ExpandingStitchRepeat;

/**
 * An expanding repeat whose repetition count cannot be solved, either because the number of
 * stitches in its row is not known or because one repetition does not consume any stitches.
 */
public class AmbiguousRepeatIssue extends Issue {

	private final ExpandingStitchRepeat repeat;

	public AmbiguousRepeatIssue(ExpandingStitchRepeat repeat) {
		this.repeat = repeat;
	}

	public ExpandingStitchRepeat getRepeat() {
		return repeat;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
