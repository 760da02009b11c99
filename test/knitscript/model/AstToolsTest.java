package knitscript.model;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static knitscript.model.KnitBuilder.*;

import java.util.Arrays;

import org.junit.Test;

public class AstToolsTest {

	@Test
	public void testMapRebuildsImmediateChildrenOnly() {
		Row r = row(stitch(Stitch.KNIT), fixed(2, stitch(Stitch.KNIT)));
		Node mapped = AstTools.map(r, child -> child instanceof StitchLit ? stitch(Stitch.PURL) : child);
		assertThat(mapped, is(row(stitch(Stitch.PURL), fixed(2, stitch(Stitch.KNIT)))));
	}

	@Test
	public void testMapLeavesLeavesAlone() {
		NaturalLit n = nat(3);
		assertThat(AstTools.map(n, child -> nat(4)), sameInstance(n));
	}

	@Test
	public void testFoldVisitsChildrenInOrder() {
		Call c = call("f", nat(1), nat(2));
		StringBuilder seen = AstTools.fold(c, (child, acc) -> acc.append(child), new StringBuilder());
		assertThat(seen.toString(), is("f12"));
	}

	@Test
	public void testChildren() {
		FixedStitchRepeat rep = fixed(3, stitch(Stitch.KNIT), stitch(Stitch.PURL));
		assertThat(AstTools.children(rep), is(Arrays.asList(stitch(Stitch.KNIT), stitch(Stitch.PURL), nat(3))));
		assertTrue(AstTools.children(ref("x")).isEmpty());
	}

}
