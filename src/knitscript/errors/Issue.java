package knitscript.errors;

import knitscript.Unreachable;
import knitscript.formatters.IndentingWriter;
import knitscript.formatters.IssueFormattingVisitor;
import knitscript.trans.KnitScriptTransException;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends KnitScriptTransException {
	public Issue() {
		super("");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	/**
	 * @return the issue with any layers of context stripped off
	 */
	public Issue getRootIssue() {
		return this;
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
