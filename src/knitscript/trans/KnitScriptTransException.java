package knitscript.trans;

import knitscript.KnitScriptException;

/**
 * Exception while turning a raw pattern AST into knittable instructions.
 */
public class KnitScriptTransException extends KnitScriptException {

	private static final long serialVersionUID = 4471093552860147217L;
	private static final String prefix = "Pattern Error";

	public KnitScriptTransException(String msg) {
		super(prefix, msg);
	}

}
