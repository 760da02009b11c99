package knitscript.trans.passes.validation;

import knitscript.errors.IssueVisitor;
import knitscript.model.Row;

public class PassOverWithoutSlipIssue extends VerificationIssue {

	public enum Reason {
		// the slip is right before the pass-over, nothing was worked in between
		NOTHING_TO_PASS_OVER("PSSO without stitch to pass over"),
		NO_SLIP("PSSO without SLIP");

		private final String message;

		Reason(String message) {
			this.message = message;
		}

		public String getMessage() {
			return message;
		}
	}

	private final Reason reason;

	public PassOverWithoutSlipIssue(Row row, Reason reason) {
		super(row);
		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
