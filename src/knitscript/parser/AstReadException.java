package knitscript.parser;

/**
 * The JSON handed over by the parser does not describe a well-formed KnitScript AST.
 */
public class AstReadException extends Exception {

	private static final long serialVersionUID = -2039475161920412387L;

	public AstReadException(String message) {
		super(message);
	}

	public AstReadException(String message, Throwable cause) {
		super(message, cause);
	}

}
