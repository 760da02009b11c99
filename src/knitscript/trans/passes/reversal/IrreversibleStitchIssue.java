package knitscript.trans.passes.reversal;

import knitscript.errors.Issue;
import knitscript.errors.IssueVisitor;
import knitscript.model.StitchLit;

/**
 * A row has to be worked from the other side, but it contains a stitch with no equivalent on that
 * side.
 */
public class IrreversibleStitchIssue extends Issue {

	private final StitchLit stitch;

	public IrreversibleStitchIssue(StitchLit stitch) {
		this.stitch = stitch;
	}

	public StitchLit getStitch() {
		return stitch;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
