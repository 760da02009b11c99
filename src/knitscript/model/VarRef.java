package knitscript.model;

import knitscript.util.SourceLocation;

import java.util.Objects;

public class VarRef extends Node {
	private final String name;

	public VarRef(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		return Objects.equals(name, ((VarRef) obj).name);
	}
}
