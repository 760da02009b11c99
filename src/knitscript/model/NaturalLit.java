package knitscript.model;

import knitscript.util.SourceLocation;

public class NaturalLit extends Node {
	private final int value;

	public NaturalLit(SourceLocation location, int value) {
		super(location);
		if (value < 0) {
			throw new IllegalArgumentException("natural literal must be non-negative, got " + value);
		}
		this.value = value;
	}

	public int getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Integer.hashCode(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		return value == ((NaturalLit) obj).value;
	}
}
