package knitscript.trans.passes.substitution;

import knitscript.errors.Issue;
import knitscript.model.*;
import knitscript.scope.ChainMap;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class SubstitutionVisitor extends NodeVisitor<Node, RuntimeException> {

	private final Map<String, Node> env;

	public SubstitutionVisitor(Map<String, Node> env) {
		this.env = env;
	}

	private Node substitute(Node node) {
		return node.accept(this);
	}

	Pattern substituteBody(Pattern pattern) {
		return pattern.withRows(AstTools.mapAll(pattern.getRows(), this::substitute));
	}

	private Node lookup(VarRef ref) {
		if (!env.containsKey(ref.getName())) {
			throw new UnboundNameIssue(ref);
		}
		return env.get(ref.getName());
	}

	/**
	 * A pattern literal without a captured environment closes over the scope it is evaluated in.
	 */
	private Node enclose(Node node) {
		if (node instanceof Pattern && ((Pattern) node).getEnv() == null) {
			return ((Pattern) node).withEnv(env);
		}
		return node;
	}

	Node evaluateCall(Call call) {
		try {
			Node target = enclose(call.getTarget() instanceof VarRef ? lookup((VarRef) call.getTarget()) :
					substitute(call.getTarget()));
			List<Node> args = AstTools.mapAll(call.getArgs(), this::substitute);
			if (target instanceof Pattern) {
				Pattern pattern = (Pattern) target;
				if (pattern.getParams().size() != args.size()) {
					throw new ArityMismatchIssue(
							call, pattern.getName(), pattern.getParams().size(), pattern.getParams().size());
				}
				// the body sees the pattern's own scope plus its parameters, never the caller's scope
				Map<String, Node> scope = new ChainMap<>(pattern.getEnv());
				for (int i = 0; i < args.size(); i++) {
					scope.put(pattern.getParams().get(i), args.get(i));
				}
				Pattern body = pattern.withParams(Collections.emptyList()).withEnv(scope);
				return new SubstitutionVisitor(scope).substituteBody(body);
			} else if (target instanceof NativeFunction) {
				NativeFunction function = (NativeFunction) target;
				if (args.size() < function.getMinArity() || args.size() > function.getMaxArity()) {
					throw new ArityMismatchIssue(call, function.getName(), function.getMinArity(),
							function.getMaxArity());
				}
				return function.apply(args);
			} else {
				throw new NotCallableIssue(call, target);
			}
		} catch (Issue issue) {
			throw issue.withContext(new ExpandingPatternCall(call));
		}
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
		return AstTools.map(fixedStitchRepeat, this::substitute);
	}

	@Override
	public Node visit(ExpandingStitchRepeat expandingStitchRepeat) {
		return AstTools.map(expandingStitchRepeat, this::substitute);
	}

	@Override
	public Node visit(Row row) {
		return AstTools.map(row, this::substitute);
	}

	@Override
	public Node visit(RowRepeat rowRepeat) {
		return AstTools.map(rowRepeat, this::substitute);
	}

	@Override
	public Node visit(Pattern pattern) {
		if (!pattern.getParams().isEmpty()) {
			// still waiting to be called
			return enclose(pattern);
		}
		if (pattern.getEnv() != null) {
			return new SubstitutionVisitor(pattern.getEnv()).substituteBody(pattern);
		}
		return substituteBody(pattern);
	}

	@Override
	public Node visit(Block block) {
		return AstTools.map(block, this::substitute);
	}

	@Override
	public Node visit(FixedBlockRepeat fixedBlockRepeat) {
		return AstTools.map(fixedBlockRepeat, this::substitute);
	}

	@Override
	public Node visit(VarRef varRef) {
		return substitute(lookup(varRef));
	}

	@Override
	public Node visit(Call call) {
		Node result = evaluateCall(call);
		if (result == null) {
			throw new VoidCallIssue(call);
		}
		return result;
	}

	@Override
	public Node visit(NativeFunction nativeFunction) {
		return nativeFunction;
	}
}
