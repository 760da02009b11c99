package knitscript;

import java.io.IOException;

/**
 * Thrown where an in-memory writer reports an I/O failure, which cannot happen.
 */
public class Unreachable extends RuntimeException {

	private static final long serialVersionUID = 7528034471126350542L;

	public Unreachable(IOException cause) {
		super("writing to memory failed", cause);
	}

}
