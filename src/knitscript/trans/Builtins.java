package knitscript.trans;

import knitscript.errors.Issue;
import knitscript.model.*;
import knitscript.trans.passes.inference.CountInferencePass;
import knitscript.trans.passes.inference.RowCounter;

import java.io.PrintStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The functions every document can call without importing them.
 */
public class Builtins {

	private Builtins() {}

	public static Map<String, Node> defaultEnvironment(PrintStream out) {
		return defaultEnvironment(out, false);
	}

	/**
	 * @param out where {@code show} and {@code note} write, or null to discard their output
	 */
	public static Map<String, Node> defaultEnvironment(PrintStream out, boolean annotateRows) {
		Map<String, Node> env = new HashMap<>();
		env.put("reflect", new NativeFunction("reflect", 1, 1, args -> reflect(args.get(0))));
		env.put("show", new NativeFunction("show", 1, 2, args -> {
			show(out, annotateRows, args);
			return null;
		}));
		env.put("note", new NativeFunction("note", 1, 1, args -> {
			note(out, args.get(0));
			return null;
		}));
		env.put("fill", new NativeFunction("fill", 3, 3, args -> fill(
				expectPattern("fill", 0, args.get(0)),
				expectNatural("fill", 1, args.get(1)),
				expectNatural("fill", 2, args.get(2)))));
		env.put("width", new NativeFunction("width", 1, 1, args ->
				new NaturalLit(args.get(0).getLocation(), width(expectPattern("width", 0, args.get(0))))));
		env.put("height", new NativeFunction("height", 1, 1, args ->
				new NaturalLit(args.get(0).getLocation(), height(expectPattern("height", 0, args.get(0))))));
		return env;
	}

	private static Pattern expectPattern(String function, int position, Node arg) {
		if (!(arg instanceof Pattern) || !((Pattern) arg).getParams().isEmpty()) {
			throw new ArgumentTypeIssue(function, position, "a pattern without parameters", arg);
		}
		return (Pattern) arg;
	}

	private static int expectNatural(String function, int position, Node arg) {
		if (!(arg instanceof NaturalLit)) {
			throw new ArgumentTypeIssue(function, position, "a natural number", arg);
		}
		return ((NaturalLit) arg).getValue();
	}

	public static Node reflect(Node node) {
		return node.accept(new ReflectionVisitor());
	}

	private static void show(PrintStream out, boolean annotateRows, List<Node> args) {
		if (out == null) {
			return;
		}
		Pattern pattern = Interpreter.preparePattern(expectPattern("show", 0, args.get(0)));
		if (args.size() > 1) {
			out.println();
			out.println(describe(args.get(1)));
			out.println();
		}
		out.println(Interpreter.export(pattern, annotateRows));
		out.println();
		for (Issue issue : Interpreter.verify(pattern)) {
			out.println("error: " + issue.getMessage());
		}
	}

	private static void note(PrintStream out, Node message) {
		if (out != null) {
			out.println(describe(message));
		}
	}

	private static String describe(Node node) {
		if (node instanceof StringLit) {
			return ((StringLit) node).getValue();
		}
		return node.toString();
	}

	/**
	 * Tiles a pattern across a box {@code width} stitches wide and {@code height} rows high.
	 *
	 * @throws NonEvenFillIssue unless the box is a whole, non-zero number of copies of the pattern
	 *                          in both directions
	 */
	public static Pattern fill(Pattern pattern, int width, int height) {
		Pattern counted = (Pattern) CountInferencePass.perform(pattern, null);
		int stitches = width(counted);
		int rows = height(counted);
		if (stitches <= 0 || rows <= 0
				|| width < stitches || width % stitches != 0
				|| height < rows || height % rows != 0) {
			throw new NonEvenFillIssue(counted, stitches, rows, width, height);
		}
		Node across = new FixedBlockRepeat(
				counted.getLocation(),
				new Block(counted.getLocation(), Collections.singletonList(counted)),
				new NaturalLit(counted.getLocation(), width / stitches));
		return counted.withRows(Collections.singletonList(new RowRepeat(
				counted.getLocation(),
				Collections.singletonList(across),
				new NaturalLit(counted.getLocation(), height / rows))));
	}

	/**
	 * @return the number of stitches the widest row of the pattern works
	 */
	public static int width(Pattern pattern) {
		Pattern counted = (Pattern) CountInferencePass.perform(pattern, null);
		int max = 0;
		for (Node row : counted.getRows()) {
			max = Math.max(max, ((Knittable) row).getConsumes());
		}
		return max;
	}

	public static int height(Pattern pattern) {
		return RowCounter.count(pattern);
	}

}
