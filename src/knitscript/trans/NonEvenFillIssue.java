package knitscript.trans;

import knitscript.errors.Issue;
import knitscript.errors.IssueVisitor;
import knitscript.model.Pattern;

public class NonEvenFillIssue extends Issue {

	private final Pattern pattern;
	private final int patternWidth;
	private final int patternHeight;
	private final int width;
	private final int height;

	public NonEvenFillIssue(Pattern pattern, int patternWidth, int patternHeight, int width, int height) {
		this.pattern = pattern;
		this.patternWidth = patternWidth;
		this.patternHeight = patternHeight;
		this.width = width;
		this.height = height;
	}

	public Pattern getPattern() {
		return pattern;
	}

	public int getPatternWidth() {
		return patternWidth;
	}

	public int getPatternHeight() {
		return patternHeight;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
