package knitscript.model;

import knitscript.util.SourceLocation;

/**
 * A call made at the top level of a document, run for its effect (typically {@code show}).
 */
public class CallStatement extends Statement {
	private final Call call;

	public CallStatement(SourceLocation location, Call call) {
		super(location);
		this.call = call;
	}

	public Call getCall() {
		return call;
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
