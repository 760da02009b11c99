package knitscript.formatters;

import knitscript.errors.IssueVisitor;
import knitscript.errors.IssueWithContext;
import knitscript.model.Node;
import knitscript.modules.CircularModuleReferenceIssue;
import knitscript.trans.ArgumentTypeIssue;
import knitscript.trans.NonEvenFillIssue;
import knitscript.trans.passes.inference.AmbiguousRepeatIssue;
import knitscript.trans.passes.reversal.IrreversibleStitchIssue;
import knitscript.trans.passes.substitution.ArityMismatchIssue;
import knitscript.trans.passes.substitution.NotCallableIssue;
import knitscript.trans.passes.substitution.UnboundNameIssue;
import knitscript.trans.passes.substitution.VoidCallIssue;
import knitscript.trans.passes.validation.LeftoverStitchesIssue;
import knitscript.trans.passes.validation.PassOverWithoutSlipIssue;
import knitscript.trans.passes.validation.TooFewStitchesIssue;
import knitscript.trans.passes.validation.TooManyStitchesIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	/**
	 * Points at where a node came from, or shows the node itself when it was built by a pass and
	 * has no place in the source.
	 */
	private void writeOrigin(Node node) throws IOException {
		if (node.getLocation().isUnknown()) {
			out.write(" in ");
			node.accept(new NodeFormattingVisitor(out));
		} else {
			out.write(" ");
			node.getLocation().writePretty(out);
		}
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(UnboundNameIssue unboundNameIssue) throws IOException {
		out.write("unbound name \"");
		out.write(unboundNameIssue.getRef().getName());
		out.write("\"");
		writeOrigin(unboundNameIssue.getRef());
		return null;
	}

	@Override
	public Void visit(ArityMismatchIssue arityMismatchIssue) throws IOException {
		out.write("called ");
		out.write(arityMismatchIssue.getCalleeName() != null ? arityMismatchIssue.getCalleeName() : "pattern");
		out.write(" with ");
		out.write(Integer.toString(arityMismatchIssue.getActual()));
		out.write(" arguments, but expected ");
		out.write(Integer.toString(arityMismatchIssue.getMinExpected()));
		if (arityMismatchIssue.getMaxExpected() != arityMismatchIssue.getMinExpected()) {
			out.write(" to ");
			out.write(Integer.toString(arityMismatchIssue.getMaxExpected()));
		}
		writeOrigin(arityMismatchIssue.getCall());
		return null;
	}

	@Override
	public Void visit(NotCallableIssue notCallableIssue) throws IOException {
		out.write("cannot call ");
		notCallableIssue.getTarget().accept(new NodeFormattingVisitor(out));
		out.write(", it is not a pattern or function");
		writeOrigin(notCallableIssue.getCall());
		return null;
	}

	@Override
	public Void visit(VoidCallIssue voidCallIssue) throws IOException {
		out.write("call to ");
		voidCallIssue.getCall().getTarget().accept(new NodeFormattingVisitor(out));
		out.write(" does not produce a value");
		writeOrigin(voidCallIssue.getCall());
		return null;
	}

	@Override
	public Void visit(AmbiguousRepeatIssue ambiguousRepeatIssue) throws IOException {
		out.write("ambiguous use of expanding stitch repeat");
		writeOrigin(ambiguousRepeatIssue.getRepeat());
		return null;
	}

	@Override
	public Void visit(IrreversibleStitchIssue irreversibleStitchIssue) throws IOException {
		out.write("cannot reverse stitch ");
		out.write(irreversibleStitchIssue.getStitch().getStitch().getSymbol());
		writeOrigin(irreversibleStitchIssue.getStitch());
		return null;
	}

	@Override
	public Void visit(NonEvenFillIssue nonEvenFillIssue) throws IOException {
		out.write(nonEvenFillIssue.getPatternWidth() + "x" + nonEvenFillIssue.getPatternHeight());
		out.write(" pattern does not fit evenly into ");
		out.write(nonEvenFillIssue.getWidth() + "x" + nonEvenFillIssue.getHeight());
		out.write(" fill box");
		writeOrigin(nonEvenFillIssue.getPattern());
		return null;
	}

	@Override
	public Void visit(ArgumentTypeIssue argumentTypeIssue) throws IOException {
		out.write("argument ");
		out.write(Integer.toString(argumentTypeIssue.getPosition() + 1));
		out.write(" of ");
		out.write(argumentTypeIssue.getFunctionName());
		out.write(" must be ");
		out.write(argumentTypeIssue.getExpected());
		out.write(", found ");
		argumentTypeIssue.getActual().accept(new NodeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(CircularModuleReferenceIssue circularModuleReferenceIssue) throws IOException {
		out.write("circular module reference: ");
		out.write(String.join(" -> ", circularModuleReferenceIssue.getChain()));
		return null;
	}

	@Override
	public Void visit(TooFewStitchesIssue tooFewStitchesIssue) throws IOException {
		out.write("expected ");
		out.write(Integer.toString(tooFewStitchesIssue.getExpected()));
		if (tooFewStitchesIssue.getAvailable() > 0) {
			out.write(" stitches, but only ");
			out.write(Integer.toString(tooFewStitchesIssue.getAvailable()));
			out.write(" are available");
		} else {
			out.write(" stitches, but none are available");
		}
		writeOrigin(tooFewStitchesIssue.getNode());
		return null;
	}

	@Override
	public Void visit(TooManyStitchesIssue tooManyStitchesIssue) throws IOException {
		out.write("expected ");
		out.write(Integer.toString(tooManyStitchesIssue.getCount()));
		out.write(" stitches to be ");
		out.write(tooManyStitchesIssue.getPhase().getDescription());
		writeOrigin(tooManyStitchesIssue.getNode());
		return null;
	}

	@Override
	public Void visit(LeftoverStitchesIssue leftoverStitchesIssue) throws IOException {
		out.write(Integer.toString(leftoverStitchesIssue.getLeftover()));
		out.write(" stitches left over");
		writeOrigin(leftoverStitchesIssue.getNode());
		return null;
	}

	@Override
	public Void visit(PassOverWithoutSlipIssue passOverWithoutSlipIssue) throws IOException {
		out.write(passOverWithoutSlipIssue.getReason().getMessage());
		writeOrigin(passOverWithoutSlipIssue.getNode());
		return null;
	}
}
