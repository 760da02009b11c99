package knitscript;

/**
 * Base of the exceptions raised while processing a document. The message starts with a prefix
 * naming the kind of error.
 */
public abstract class KnitScriptException extends RuntimeException {

	private static final long serialVersionUID = 1809541390227164723L;

	public KnitScriptException(String prefix, String msg) {
		super(prefix + ": " + msg);
	}
}
