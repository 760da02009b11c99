package knitscript;

/**
 * A command line or configuration file that cannot be used.
 */
public class KnitScriptOptionException extends Exception {

	private static final long serialVersionUID = -4418150853640587709L;

	public KnitScriptOptionException(String message) {
		super(message);
	}
}
