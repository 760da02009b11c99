package knitscript.model;

import knitscript.Unreachable;
import knitscript.formatters.IndentingWriter;
import knitscript.formatters.NodeFormattingVisitor;
import knitscript.util.SourceLocatable;
import knitscript.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * An immutable KnitScript expression. Passes never modify a node, they build a new tree.
 *
 * Equality is structural and ignores source locations.
 */
public abstract class Node extends SourceLocatable {

	private final SourceLocation location;

	public Node(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	public abstract <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w, "\n");
		try {
			accept(new NodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
