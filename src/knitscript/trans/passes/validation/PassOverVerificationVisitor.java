package knitscript.trans.passes.validation;

import knitscript.InternalCompilerError;
import knitscript.errors.IssueContext;
import knitscript.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that every PSSO in a row has an earlier slipped stitch, not yet passed over, to lift.
 */
public class PassOverVerificationVisitor extends NodeVisitor<Void, RuntimeException> {

	private final IssueContext ctx;

	public PassOverVerificationVisitor(IssueContext ctx) {
		this.ctx = ctx;
	}

	private static void unroll(Node node, List<Stitch> into) {
		if (node instanceof StitchLit) {
			into.add(((StitchLit) node).getStitch());
		} else if (node instanceof FixedStitchRepeat) {
			FixedStitchRepeat fixed = (FixedStitchRepeat) node;
			int times = ((NaturalLit) fixed.getTimes()).getValue();
			for (int i = 0; i < times; i++) {
				for (Node stitch : fixed.getStitches()) {
					unroll(stitch, into);
				}
			}
		} else if (node instanceof ExpandingStitchRepeat) {
			ExpandingStitchRepeat expanding = (ExpandingStitchRepeat) node;
			if (expanding.getTimes() == null) {
				throw new InternalCompilerError("expanding repeat was not counted: " + expanding);
			}
			for (int i = 0; i < expanding.getTimes(); i++) {
				for (Node stitch : expanding.getStitches()) {
					unroll(stitch, into);
				}
			}
		} else {
			throw new InternalCompilerError("expected stitches, found " + node);
		}
	}

	@Override
	public Void visit(Row row) {
		List<Stitch> stitches = new ArrayList<>();
		for (Node stitch : row.getStitches()) {
			unroll(stitch, stitches);
		}
		List<Stitch> worked = new ArrayList<>();
		for (Stitch stitch : stitches) {
			if (stitch != Stitch.PSSO) {
				worked.add(stitch);
				continue;
			}
			if (!worked.isEmpty() && worked.get(worked.size() - 1) == Stitch.SLIP) {
				ctx.error(new PassOverWithoutSlipIssue(row, PassOverWithoutSlipIssue.Reason.NOTHING_TO_PASS_OVER));
				worked.remove(worked.size() - 1);
				continue;
			}
			int slip = worked.lastIndexOf(Stitch.SLIP);
			if (slip == -1) {
				ctx.error(new PassOverWithoutSlipIssue(row, PassOverWithoutSlipIssue.Reason.NO_SLIP));
			} else {
				worked.remove(slip);
			}
		}
		return null;
	}

	@Override
	public Void visit(RowRepeat rowRepeat) {
		for (Node row : rowRepeat.getRows()) {
			row.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(Pattern pattern) {
		for (Node row : pattern.getRows()) {
			row.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(NaturalLit naturalLit) {
		throw new InternalCompilerError("expected rows, found " + naturalLit);
	}

	@Override
	public Void visit(StringLit stringLit) {
		throw new InternalCompilerError("expected rows, found " + stringLit);
	}

	@Override
	public Void visit(StitchLit stitchLit) {
		throw new InternalCompilerError("expected rows, found " + stitchLit);
	}

	@Override
	public Void visit(FixedStitchRepeat fixedStitchRepeat) {
		throw new InternalCompilerError("expected rows, found " + fixedStitchRepeat);
	}

	@Override
	public Void visit(ExpandingStitchRepeat expandingStitchRepeat) {
		throw new InternalCompilerError("expected rows, found " + expandingStitchRepeat);
	}

	@Override
	public Void visit(Block block) {
		throw new InternalCompilerError("cannot verify an unflattened block: " + block);
	}

	@Override
	public Void visit(FixedBlockRepeat fixedBlockRepeat) {
		throw new InternalCompilerError("cannot verify an unflattened block repeat: " + fixedBlockRepeat);
	}

	@Override
	public Void visit(VarRef varRef) {
		throw new InternalCompilerError("unsubstituted name reached verification: " + varRef);
	}

	@Override
	public Void visit(Call call) {
		throw new InternalCompilerError("unsubstituted call reached verification: " + call);
	}

	@Override
	public Void visit(NativeFunction nativeFunction) {
		throw new InternalCompilerError("expected rows, found " + nativeFunction);
	}
}
