package knitscript.modules;

import knitscript.errors.Context;
import knitscript.errors.ContextVisitor;
import knitscript.model.UsingStatement;

public class WhileLoadingModule extends Context {

	private final UsingStatement using;

	public WhileLoadingModule(UsingStatement using) {
		this.using = using;
	}

	public UsingStatement getUsing() {
		return using;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
