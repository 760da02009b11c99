package knitscript.formatters;

import knitscript.InternalCompilerError;
import knitscript.model.*;

import java.io.IOException;
import java.util.List;

/**
 * Renders a prepared pattern as written knitting instructions, one row per line:
 *
 * <pre>
 * CO 12.
 * **
 * [K 2, P 2] 3.
 * *P 2, K 2; rep from * to end.
 * rep from ** 4 times.
 * BO 12.
 * </pre>
 */
public class InstructionFormattingVisitor extends NodeVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final boolean annotateRows;

	public InstructionFormattingVisitor(IndentingWriter out, boolean annotateRows) {
		this.out = out;
		this.annotateRows = annotateRows;
	}

	private void writeStitches(List<Node> stitches) throws IOException {
		boolean first = true;
		for (Node stitch : stitches) {
			if (!first) {
				out.write(", ");
			}
			first = false;
			stitch.accept(this);
		}
	}

	private void writeRows(List<Node> rows) throws IOException {
		boolean first = true;
		for (Node row : rows) {
			if (!first) {
				out.newLine();
			}
			first = false;
			if (annotateRows && row instanceof Row && ((Row) row).getSide() != null) {
				out.write(((Row) row).getSide().getSymbol());
				out.write(": ");
			}
			row.accept(this);
			if (row instanceof Row || row instanceof RowRepeat && !once((RowRepeat) row)) {
				// rows inside a once-only repeat or a nested pattern end themselves
				out.write(".");
			}
			if (annotateRows && row instanceof Row && ((Row) row).hasCounts()) {
				out.write(" (");
				out.write(Integer.toString(((Row) row).getProduces()));
				out.write(" sts)");
			}
		}
	}

	private static boolean once(RowRepeat rowRepeat) {
		return rowRepeat.getTimes().equals(new NaturalLit(rowRepeat.getLocation(), 1));
	}

	@Override
	public Void visit(StitchLit stitchLit) throws IOException {
		out.write(stitchLit.getStitch().getSymbol());
		return null;
	}

	@Override
	public Void visit(FixedStitchRepeat fixedStitchRepeat) throws IOException {
		boolean once = fixedStitchRepeat.getTimes().equals(new NaturalLit(fixedStitchRepeat.getLocation(), 1));
		boolean bracket = !once && fixedStitchRepeat.getStitches().size() != 1;
		if (bracket) {
			out.write("[");
		}
		writeStitches(fixedStitchRepeat.getStitches());
		if (bracket) {
			out.write("]");
		}
		if (!once) {
			out.write(" ");
			fixedStitchRepeat.getTimes().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(ExpandingStitchRepeat expandingStitchRepeat) throws IOException {
		out.write("*");
		writeStitches(expandingStitchRepeat.getStitches());
		out.write("; rep from * to ");
		if (expandingStitchRepeat.getToLast().equals(new NaturalLit(expandingStitchRepeat.getLocation(), 0))) {
			out.write("end");
		} else {
			out.write("last ");
			expandingStitchRepeat.getToLast().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(Row row) throws IOException {
		writeStitches(row.getStitches());
		return null;
	}

	@Override
	public Void visit(RowRepeat rowRepeat) throws IOException {
		if (once(rowRepeat)) {
			writeRows(rowRepeat.getRows());
			return null;
		}
		out.write("**");
		out.newLine();
		writeRows(rowRepeat.getRows());
		out.newLine();
		out.write("rep from ** ");
		rowRepeat.getTimes().accept(this);
		out.write(" times");
		return null;
	}

	@Override
	public Void visit(Pattern pattern) throws IOException {
		writeRows(pattern.getRows());
		return null;
	}

	@Override
	public Void visit(NaturalLit naturalLit) throws IOException {
		out.write(Integer.toString(naturalLit.getValue()));
		return null;
	}

	@Override
	public Void visit(StringLit stringLit) throws IOException {
		out.write(stringLit.getValue());
		return null;
	}

	@Override
	public Void visit(Block block) throws IOException {
		throw new InternalCompilerError("blocks must be flattened before exporting: " + block);
	}

	@Override
	public Void visit(FixedBlockRepeat fixedBlockRepeat) throws IOException {
		throw new InternalCompilerError("blocks must be flattened before exporting: " + fixedBlockRepeat);
	}

	@Override
	public Void visit(VarRef varRef) throws IOException {
		throw new InternalCompilerError("unsubstituted name reached export: " + varRef);
	}

	@Override
	public Void visit(Call call) throws IOException {
		throw new InternalCompilerError("unsubstituted call reached export: " + call);
	}

	@Override
	public Void visit(NativeFunction nativeFunction) throws IOException {
		throw new InternalCompilerError("function value reached export: " + nativeFunction);
	}
}
