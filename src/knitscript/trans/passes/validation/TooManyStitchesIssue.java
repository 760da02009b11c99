package knitscript.trans.passes.validation;

import knitscript.errors.IssueVisitor;
import knitscript.model.Node;

/**
 * A pattern that does not start from an empty needle or does not end on one.
 */
public class TooManyStitchesIssue extends VerificationIssue {

	public enum Phase {
		CAST_ON("cast on"),
		BIND_OFF("bound off");

		private final String description;

		Phase(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final int count;
	private final Phase phase;

	public TooManyStitchesIssue(Node node, int count, Phase phase) {
		super(node);
		this.count = count;
		this.phase = phase;
	}

	/**
	 * @return the number of stitches that would have to be cast on or bound off outside the pattern
	 */
	public int getCount() {
		return count;
	}

	public Phase getPhase() {
		return phase;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
