package knitscript.model;

import knitscript.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A function provided by the host rather than written in KnitScript. It is called like a
 * pattern, with already substituted arguments.
 */
public class NativeFunction extends Node {

	@FunctionalInterface
	public interface Implementation {
		/**
		 * @return the resulting expression, or null if the function is only run for its effect
		 */
		Node apply(List<Node> args);
	}

	private final String name;
	private final int minArity;
	private final int maxArity;
	private final Implementation implementation;

	public NativeFunction(String name, int minArity, int maxArity, Implementation implementation) {
		super(SourceLocation.unknown());
		this.name = name;
		this.minArity = minArity;
		this.maxArity = maxArity;
		this.implementation = implementation;
	}

	public String getName() {
		return name;
	}

	public int getMinArity() {
		return minArity;
	}

	public int getMaxArity() {
		return maxArity;
	}

	public Node apply(List<Node> args) {
		return implementation.apply(args);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, implementation);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		NativeFunction other = (NativeFunction) obj;
		return Objects.equals(name, other.name) && implementation == other.implementation;
	}
}
