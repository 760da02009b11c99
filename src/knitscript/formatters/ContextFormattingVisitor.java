package knitscript.formatters;

import knitscript.errors.ContextVisitor;
import knitscript.modules.WhileLoadingModule;
import knitscript.trans.passes.substitution.ExpandingPatternCall;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileLoadingModule whileLoadingModule) throws IOException {
		out.write("while loading module \"");
		out.write(whileLoadingModule.getUsing().getModule());
		out.write("\" ");
		whileLoadingModule.getUsing().getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(ExpandingPatternCall expandingPatternCall) throws IOException {
		out.write("while expanding call to ");
		expandingPatternCall.getCall().getTarget().accept(new NodeFormattingVisitor(out));
		out.write(" ");
		expandingPatternCall.getCall().getLocation().writePretty(out);
		return null;
	}

}
