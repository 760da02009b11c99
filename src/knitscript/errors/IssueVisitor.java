package knitscript.errors;

import knitscript.modules.CircularModuleReferenceIssue;
import knitscript.trans.ArgumentTypeIssue;
import knitscript.trans.NonEvenFillIssue;
import knitscript.trans.passes.inference.AmbiguousRepeatIssue;
import knitscript.trans.passes.reversal.IrreversibleStitchIssue;
import knitscript.trans.passes.substitution.ArityMismatchIssue;
import knitscript.trans.passes.substitution.NotCallableIssue;
import knitscript.trans.passes.substitution.UnboundNameIssue;
import knitscript.trans.passes.substitution.VoidCallIssue;
import knitscript.trans.passes.validation.LeftoverStitchesIssue;
import knitscript.trans.passes.validation.PassOverWithoutSlipIssue;
import knitscript.trans.passes.validation.TooFewStitchesIssue;
import knitscript.trans.passes.validation.TooManyStitchesIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(UnboundNameIssue unboundNameIssue) throws E;
	public abstract T visit(ArityMismatchIssue arityMismatchIssue) throws E;
	public abstract T visit(NotCallableIssue notCallableIssue) throws E;
	public abstract T visit(VoidCallIssue voidCallIssue) throws E;
	public abstract T visit(AmbiguousRepeatIssue ambiguousRepeatIssue) throws E;
	public abstract T visit(IrreversibleStitchIssue irreversibleStitchIssue) throws E;
	public abstract T visit(NonEvenFillIssue nonEvenFillIssue) throws E;
	public abstract T visit(ArgumentTypeIssue argumentTypeIssue) throws E;
	public abstract T visit(CircularModuleReferenceIssue circularModuleReferenceIssue) throws E;
	public abstract T visit(TooFewStitchesIssue tooFewStitchesIssue) throws E;
	public abstract T visit(TooManyStitchesIssue tooManyStitchesIssue) throws E;
	public abstract T visit(LeftoverStitchesIssue leftoverStitchesIssue) throws E;
	public abstract T visit(PassOverWithoutSlipIssue passOverWithoutSlipIssue) throws E;
}
