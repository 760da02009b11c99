package knitscript.model;

import knitscript.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class Call extends Node {
	private final Node target;
	private final List<Node> args;

	public Call(SourceLocation location, Node target, List<Node> args) {
		super(location);
		this.target = target;
		this.args = Collections.unmodifiableList(args);
	}

	public Node getTarget() {
		return target;
	}

	public List<Node> getArgs() {
		return args;
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, args);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		Call other = (Call) obj;
		return Objects.equals(target, other.target) && args.equals(other.args);
	}
}
