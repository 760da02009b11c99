package knitscript.model;

import knitscript.util.SourceLocation;

public class PatternDefinition extends Statement {
	private final String name;
	private final Node pattern;

	public PatternDefinition(SourceLocation location, String name, Node pattern) {
		super(location);
		this.name = name;
		this.pattern = pattern;
	}

	public String getName() {
		return name;
	}

	public Node getPattern() {
		return pattern;
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
