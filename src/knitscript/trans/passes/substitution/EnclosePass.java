package knitscript.trans.passes.substitution;

import knitscript.model.AstTools;
import knitscript.model.Node;
import knitscript.model.Pattern;

import java.util.Map;

/**
 * Gives every pattern literal in an expression the environment it is being defined in. Patterns
 * nested inside a pattern are left to be enclosed when their parent's body is substituted.
 */
public class EnclosePass {

	private EnclosePass() {}

	public static Node perform(Node node, Map<String, Node> env) {
		if (node instanceof Pattern) {
			return ((Pattern) node).withEnv(env);
		}
		return AstTools.map(node, child -> perform(child, env));
	}

}
