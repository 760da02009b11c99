package knitscript.trans.passes.normalising;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static knitscript.model.KnitBuilder.*;

import knitscript.model.*;
import org.junit.Test;

public class StitchCombiningPassTest {

	private static final StitchLit K = stitch(Stitch.KNIT);
	private static final StitchLit P = stitch(Stitch.PURL);

	@Test
	public void testRunsOfOneStitchCombine() {
		Node combined = StitchCombiningPass.perform(row(K, K, fixed(3, K), P));
		assertThat(combined, is(row(fixed(5, K), P)));
	}

	@Test
	public void testMultiStitchRepeatsAreLeftAlone() {
		Row r = row(fixed(2, K, P), fixed(2, K, P));
		assertThat(StitchCombiningPass.perform(r), is(r));
	}

	@Test
	public void testCombinesInsideRepeatsAndPatterns() {
		Node combined = StitchCombiningPass.perform(pattern(
				row(expanding(P, P, K)),
				rows(2, row(K, K))));
		assertThat(combined, is(pattern(
				row(expanding(fixed(2, P), K)),
				rows(2, row(fixed(2, K))))));
	}

}
