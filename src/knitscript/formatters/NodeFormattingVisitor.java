package knitscript.formatters;

import knitscript.model.*;

import java.io.IOException;
import java.util.List;

/**
 * Writes an expression in a compact, KnitScript-like notation, for diagnostics and debugging.
 */
public class NodeFormattingVisitor extends NodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public NodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeList(List<Node> nodes) throws IOException {
		boolean first = true;
		for (Node node : nodes) {
			if (!first) {
				out.write(", ");
			}
			first = false;
			node.accept(this);
		}
	}

	private void writeBlock(List<Node> nodes) throws IOException {
		out.write("{");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Node node : nodes) {
				out.newLine();
				node.accept(this);
			}
		}
		out.newLine();
		out.write("}");
	}

	@Override
	public Void visit(NaturalLit naturalLit) throws IOException {
		out.write(Integer.toString(naturalLit.getValue()));
		return null;
	}

	@Override
	public Void visit(StringLit stringLit) throws IOException {
		out.write("\"");
		out.write(stringLit.getValue());
		out.write("\"");
		return null;
	}

	@Override
	public Void visit(StitchLit stitchLit) throws IOException {
		out.write(stitchLit.getStitch().getSymbol());
		return null;
	}

	@Override
	public Void visit(FixedStitchRepeat fixedStitchRepeat) throws IOException {
		if (fixedStitchRepeat.getStitches().size() == 1) {
			fixedStitchRepeat.getStitches().get(0).accept(this);
		} else {
			out.write("[");
			writeList(fixedStitchRepeat.getStitches());
			out.write("]");
		}
		out.write(" ");
		fixedStitchRepeat.getTimes().accept(this);
		return null;
	}

	@Override
	public Void visit(ExpandingStitchRepeat expandingStitchRepeat) throws IOException {
		out.write("[");
		writeList(expandingStitchRepeat.getStitches());
		out.write("] to last ");
		expandingStitchRepeat.getToLast().accept(this);
		return null;
	}

	@Override
	public Void visit(Row row) throws IOException {
		out.write("row");
		if (row.getSide() != null) {
			out.write(" ");
			out.write(row.getSide().getSymbol());
		}
		out.write(": ");
		writeList(row.getStitches());
		return null;
	}

	@Override
	public Void visit(RowRepeat rowRepeat) throws IOException {
		out.write("rows ");
		writeBlock(rowRepeat.getRows());
		out.write(" ");
		rowRepeat.getTimes().accept(this);
		return null;
	}

	@Override
	public Void visit(Pattern pattern) throws IOException {
		out.write("pattern");
		if (pattern.getName() != null) {
			out.write(" ");
			out.write(pattern.getName());
		}
		if (!pattern.getParams().isEmpty()) {
			out.write("(");
			out.write(String.join(", ", pattern.getParams()));
			out.write(")");
		}
		out.write(" ");
		writeBlock(pattern.getRows());
		return null;
	}

	@Override
	public Void visit(Block block) throws IOException {
		out.write("block ");
		writeBlock(block.getPatterns());
		return null;
	}

	@Override
	public Void visit(FixedBlockRepeat fixedBlockRepeat) throws IOException {
		fixedBlockRepeat.getBlock().accept(this);
		out.write(" ");
		fixedBlockRepeat.getTimes().accept(this);
		return null;
	}

	@Override
	public Void visit(VarRef varRef) throws IOException {
		out.write(varRef.getName());
		return null;
	}

	@Override
	public Void visit(Call call) throws IOException {
		call.getTarget().accept(this);
		out.write("(");
		writeList(call.getArgs());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(NativeFunction nativeFunction) throws IOException {
		out.write("<native function ");
		out.write(nativeFunction.getName());
		out.write(">");
		return null;
	}
}
