package knitscript.model;

import knitscript.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Patterns placed side by side, each working its own stitches of the same rows.
 */
public class Block extends Knittable {
	private final List<Node> patterns;

	public Block(SourceLocation location, List<Node> patterns) {
		super(location);
		this.patterns = Collections.unmodifiableList(patterns);
	}

	public List<Node> getPatterns() {
		return patterns;
	}

	public Block withPatterns(List<Node> newPatterns) {
		return new Block(getLocation(), newPatterns);
	}

	@Override
	protected StitchCounts deriveCounts() {
		return sum(patterns);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(patterns);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		return patterns.equals(((Block) obj).patterns);
	}
}
