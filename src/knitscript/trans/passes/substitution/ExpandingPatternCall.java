package knitscript.trans.passes.substitution;

import knitscript.errors.Context;
import knitscript.errors.ContextVisitor;
import knitscript.model.Call;

public class ExpandingPatternCall extends Context {

	private final Call call;

	public ExpandingPatternCall(Call call) {
		this.call = call;
	}

	public Call getCall() {
		return call;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
