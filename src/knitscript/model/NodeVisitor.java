package knitscript.model;

public abstract class NodeVisitor<T, E extends Throwable> {

	public abstract T visit(NaturalLit naturalLit) throws E;
	public abstract T visit(StringLit stringLit) throws E;
	public abstract T visit(StitchLit stitchLit) throws E;
	public abstract T visit(FixedStitchRepeat fixedStitchRepeat) throws E;
	public abstract T visit(ExpandingStitchRepeat expandingStitchRepeat) throws E;
	public abstract T visit(Row row) throws E;
	public abstract T visit(RowRepeat rowRepeat) throws E;
	public abstract T visit(Pattern pattern) throws E;
	public abstract T visit(Block block) throws E;
	public abstract T visit(FixedBlockRepeat fixedBlockRepeat) throws E;
	public abstract T visit(VarRef varRef) throws E;
	public abstract T visit(Call call) throws E;
	public abstract T visit(NativeFunction nativeFunction) throws E;

}
