package knitscript.errors;

import knitscript.modules.WhileLoadingModule;
import knitscript.trans.passes.substitution.ExpandingPatternCall;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileLoadingModule whileLoadingModule) throws E;
	public abstract T visit(ExpandingPatternCall expandingPatternCall) throws E;

}
