package knitscript.model;

import knitscript.util.SourceLocatable;
import knitscript.util.SourceLocation;

/**
 * A top-level statement of a KnitScript document.
 */
public abstract class Statement extends SourceLocatable {

	private final SourceLocation location;

	public Statement(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public abstract <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E;

}
