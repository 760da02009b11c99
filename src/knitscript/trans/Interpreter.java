package knitscript.trans;

import knitscript.Unreachable;
import knitscript.errors.Issue;
import knitscript.formatters.IndentingWriter;
import knitscript.formatters.InstructionFormattingVisitor;
import knitscript.model.Node;
import knitscript.model.Pattern;
import knitscript.model.Side;
import knitscript.trans.passes.inference.CountInferencePass;
import knitscript.trans.passes.inference.SideInferencePass;
import knitscript.trans.passes.normalising.FlattenPass;
import knitscript.trans.passes.normalising.StitchCombiningPass;
import knitscript.trans.passes.reversal.AlternationPass;
import knitscript.trans.passes.substitution.SubstitutionPass;
import knitscript.trans.passes.validation.VerificationPass;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.logging.Logger;

/**
 * Drives a pattern through the passes that turn it into knittable instructions.
 */
public class Interpreter {

	private static final Logger logger = Logger.getLogger("knitscript.interpreter");

	private Interpreter() {}

	/**
	 * Prepares a parameterless pattern for export: every name and call is substituted, every row
	 * has a side, every expanding repeat has a count, blocks are composed into rows and rows
	 * alternate sides.
	 *
	 * @throws Issue if the pattern cannot be prepared
	 */
	public static Pattern preparePattern(Pattern pattern) {
		logger.fine("substituting " + describe(pattern));
		Node node = SubstitutionPass.perform(pattern);

		logger.fine("inferring sides");
		node = SideInferencePass.perform(node, Side.RIGHT);

		logger.fine("inferring counts");
		node = CountInferencePass.perform(node, null);

		logger.fine("flattening");
		node = FlattenPass.perform(node);
		node = CountInferencePass.perform(node, null);

		logger.fine("alternating sides");
		node = AlternationPass.perform(node, SideInferencePass.startingSide((Pattern) node));

		logger.fine("combining stitches");
		return (Pattern) StitchCombiningPass.perform(node);
	}

	/**
	 * @return the problems found in a prepared pattern, in the order they occur
	 */
	public static List<Issue> verify(Pattern pattern) {
		return VerificationPass.verify(pattern);
	}

	/**
	 * Renders a prepared pattern as written instructions, one row per line.
	 */
	public static String export(Pattern pattern, boolean annotateRows) {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw, "\n");
		try {
			pattern.accept(new InstructionFormattingVisitor(out, annotateRows));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return sw.toString();
	}

	public static String export(Pattern pattern) {
		return export(pattern, false);
	}

	private static String describe(Pattern pattern) {
		return pattern.getName() != null ? "pattern " + pattern.getName() : "anonymous pattern";
	}

}
