package knitscript.model;

import knitscript.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * Imports the named patterns from another module, e.g. {@code using rib, seed from stitches}.
 */
public class UsingStatement extends Statement {
	private final List<String> names;
	private final String module;

	public UsingStatement(SourceLocation location, List<String> names, String module) {
		super(location);
		this.names = Collections.unmodifiableList(names);
		this.module = module;
	}

	public List<String> getNames() {
		return names;
	}

	public String getModule() {
		return module;
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
