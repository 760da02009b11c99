package knitscript.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Generic single-level tree walks. Passes handle the node kinds they care about and use these for
 * the rest, recursing explicitly through the function they pass in.
 */
public class AstTools {
	private AstTools() {}

	/**
	 * Rebuilds a node with {@code function} applied to each of its immediate children. Leaves are
	 * returned unchanged.
	 */
	public static Node map(Node node, Function<Node, Node> function) {
		return node.accept(new ChildMappingVisitor(function));
	}

	/**
	 * Accumulates over the immediate children of a node, left to right.
	 */
	public static <T> T fold(Node node, BiFunction<Node, T, T> function, T initial) {
		T acc = initial;
		for (Node child : children(node)) {
			acc = function.apply(child, acc);
		}
		return acc;
	}

	public static List<Node> children(Node node) {
		return node.accept(new NodeVisitor<List<Node>, RuntimeException>() {
			@Override
			public List<Node> visit(NaturalLit naturalLit) {
				return Collections.emptyList();
			}

			@Override
			public List<Node> visit(StringLit stringLit) {
				return Collections.emptyList();
			}

			@Override
			public List<Node> visit(StitchLit stitchLit) {
				return Collections.emptyList();
			}

			@Override
			public List<Node> visit(FixedStitchRepeat fixedStitchRepeat) {
				List<Node> result = new ArrayList<>(fixedStitchRepeat.getStitches());
				result.add(fixedStitchRepeat.getTimes());
				return result;
			}

			@Override
			public List<Node> visit(ExpandingStitchRepeat expandingStitchRepeat) {
				List<Node> result = new ArrayList<>(expandingStitchRepeat.getStitches());
				result.add(expandingStitchRepeat.getToLast());
				return result;
			}

			@Override
			public List<Node> visit(Row row) {
				return row.getStitches();
			}

			@Override
			public List<Node> visit(RowRepeat rowRepeat) {
				List<Node> result = new ArrayList<>(rowRepeat.getRows());
				result.add(rowRepeat.getTimes());
				return result;
			}

			@Override
			public List<Node> visit(Pattern pattern) {
				return pattern.getRows();
			}

			@Override
			public List<Node> visit(Block block) {
				return block.getPatterns();
			}

			@Override
			public List<Node> visit(FixedBlockRepeat fixedBlockRepeat) {
				return Arrays.asList(fixedBlockRepeat.getBlock(), fixedBlockRepeat.getTimes());
			}

			@Override
			public List<Node> visit(VarRef varRef) {
				return Collections.emptyList();
			}

			@Override
			public List<Node> visit(Call call) {
				List<Node> result = new ArrayList<>();
				result.add(call.getTarget());
				result.addAll(call.getArgs());
				return result;
			}

			@Override
			public List<Node> visit(NativeFunction nativeFunction) {
				return Collections.emptyList();
			}
		});
	}

	public static List<Node> mapAll(List<Node> nodes, Function<Node, Node> function) {
		List<Node> result = new ArrayList<>(nodes.size());
		for (Node node : nodes) {
			result.add(function.apply(node));
		}
		return result;
	}

	private static class ChildMappingVisitor extends NodeVisitor<Node, RuntimeException> {
		private final Function<Node, Node> function;

		ChildMappingVisitor(Function<Node, Node> function) {
			this.function = function;
		}

		@Override
		public Node visit(NaturalLit naturalLit) {
			return naturalLit;
		}

		@Override
		public Node visit(StringLit stringLit) {
			return stringLit;
		}

		@Override
		public Node visit(StitchLit stitchLit) {
			return stitchLit;
		}

		@Override
		public Node visit(FixedStitchRepeat fixedStitchRepeat) {
			return new FixedStitchRepeat(
					fixedStitchRepeat.getLocation(),
					mapAll(fixedStitchRepeat.getStitches(), function),
					function.apply(fixedStitchRepeat.getTimes()));
		}

		@Override
		public Node visit(ExpandingStitchRepeat expandingStitchRepeat) {
			return new ExpandingStitchRepeat(
					expandingStitchRepeat.getLocation(),
					mapAll(expandingStitchRepeat.getStitches(), function),
					function.apply(expandingStitchRepeat.getToLast()),
					expandingStitchRepeat.getTimes());
		}

		@Override
		public Node visit(Row row) {
			return row.withStitches(mapAll(row.getStitches(), function));
		}

		@Override
		public Node visit(RowRepeat rowRepeat) {
			return new RowRepeat(
					rowRepeat.getLocation(),
					mapAll(rowRepeat.getRows(), function),
					function.apply(rowRepeat.getTimes()));
		}

		@Override
		public Node visit(Pattern pattern) {
			return pattern.withRows(mapAll(pattern.getRows(), function));
		}

		@Override
		public Node visit(Block block) {
			return block.withPatterns(mapAll(block.getPatterns(), function));
		}

		@Override
		public Node visit(FixedBlockRepeat fixedBlockRepeat) {
			return new FixedBlockRepeat(
					fixedBlockRepeat.getLocation(),
					function.apply(fixedBlockRepeat.getBlock()),
					function.apply(fixedBlockRepeat.getTimes()));
		}

		@Override
		public Node visit(VarRef varRef) {
			return varRef;
		}

		@Override
		public Node visit(Call call) {
			return new Call(call.getLocation(), function.apply(call.getTarget()), mapAll(call.getArgs(), function));
		}

		@Override
		public Node visit(NativeFunction nativeFunction) {
			return nativeFunction;
		}
	}
}
