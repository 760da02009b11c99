package knitscript.errors;

/**
 * Where non-fatal issues are reported while a pass keeps going.
 */
public abstract class IssueContext {

	public abstract void error(Issue err);

}
