package knitscript;

/**
 * Thrown when a pass receives a tree that an earlier pass should have ruled out, e.g. a variable
 * reference reaching count inference.
 */
public class InternalCompilerError extends RuntimeException {

	private static final long serialVersionUID = -2291537408613125412L;

	public InternalCompilerError(String detail) {
		super("internal compiler error: " + detail);
	}
}
