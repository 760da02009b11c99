package knitscript.model;

public abstract class StatementVisitor<T, E extends Throwable> {

	public abstract T visit(UsingStatement usingStatement) throws E;
	public abstract T visit(PatternDefinition patternDefinition) throws E;
	public abstract T visit(CallStatement callStatement) throws E;

}
