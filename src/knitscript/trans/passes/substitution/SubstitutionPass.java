package knitscript.trans.passes.substitution;

import knitscript.model.Call;
import knitscript.model.Node;
import knitscript.model.Pattern;

import java.util.Collections;
import java.util.Map;

public class SubstitutionPass {

	private SubstitutionPass() {}

	/**
	 * Substitutes every name and call in the expression, resolving names in {@code env}.
	 */
	public static Node perform(Node node, Map<String, Node> env) {
		return node.accept(new SubstitutionVisitor(env));
	}

	/**
	 * Substitutes the body of a pattern under its own captured environment. Any parameters the
	 * pattern declares are not bound, so referring to one is an unbound name.
	 */
	public static Pattern perform(Pattern pattern) {
		Map<String, Node> env = pattern.getEnv() != null ? pattern.getEnv() : Collections.emptyMap();
		return new SubstitutionVisitor(env).substituteBody(pattern);
	}

	/**
	 * Runs a call for its result, which is null for calls made only for their effect.
	 */
	public static Node performCall(Call call, Map<String, Node> env) {
		return new SubstitutionVisitor(env).evaluateCall(call);
	}

}
