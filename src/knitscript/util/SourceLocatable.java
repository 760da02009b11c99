package knitscript.util;

/**
 *
 * A common abstract base for AST nodes and statements, anything that needs to be traced back to
 * the place in a KnitScript document it was parsed from.
 *
 * Nodes synthesized by a pass (merged rows, tiled blocks) carry either a location combined from
 * the nodes they were built from, or an unknown location.
 *
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
