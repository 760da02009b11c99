package knitscript.model;

import knitscript.util.SourceLocation;

import java.util.Objects;

public class StringLit extends Node {
	private final String value;

	public StringLit(SourceLocation location, String value) {
		super(location);
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		return Objects.equals(value, ((StringLit) obj).value);
	}
}
