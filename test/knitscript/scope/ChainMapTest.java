package knitscript.scope;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;

import org.junit.Test;

public class ChainMapTest {

	@Test
	public void testLocalBindingShadowsParent() {
		Map<String, Integer> parent = new HashMap<>();
		parent.put("a", 1);
		parent.put("b", 2);
		ChainMap<String, Integer> child = new ChainMap<>(parent);
		child.put("a", 10);

		assertThat(child.get("a"), is(10));
		assertThat(child.get("b"), is(2));
		assertThat(child.size(), is(2));
		assertThat(child.keySet(), is(new HashSet<>(Arrays.asList("a", "b"))));
	}

	@Test
	public void testWritesNeverReachParent() {
		Map<String, Integer> parent = new HashMap<>();
		parent.put("a", 1);
		ChainMap<String, Integer> child = new ChainMap<>(parent);
		child.put("c", 3);
		child.remove("a");

		assertThat(parent.containsKey("c"), is(false));
		assertThat(parent.get("a"), is(1));
		assertThat(child.get("a"), is(1));
	}

}
