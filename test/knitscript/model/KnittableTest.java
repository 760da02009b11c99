package knitscript.model;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static knitscript.model.KnitBuilder.*;

import java.util.Iterator;

import knitscript.InternalCompilerError;
import org.junit.Test;

public class KnittableTest {

	@Test
	public void testFixedRepeatMultipliesCounts() {
		FixedStitchRepeat rep = fixed(3, stitch(Stitch.KNIT2TOG), stitch(Stitch.YARN_OVER));
		assertThat(rep.getCounts(), is(new StitchCounts(6, 6)));
	}

	@Test
	public void testRowSumsStitches() {
		Row r = row(stitch(Stitch.SLIP), stitch(Stitch.KNIT), stitch(Stitch.PSSO));
		assertThat(r.getConsumes(), is(2));
		assertThat(r.getProduces(), is(1));
	}

	@Test
	public void testExpandingRepeatUnknownUntilCounted() {
		ExpandingStitchRepeat rep = expanding(stitch(Stitch.KNIT), stitch(Stitch.PURL));
		assertFalse(rep.hasCounts());
		assertFalse(row(stitch(Stitch.KNIT), rep).hasCounts());
		assertThat(rep.getUnitCounts(), is(new StitchCounts(2, 2)));
		assertThat(rep.withTimes(4).getCounts(), is(new StitchCounts(8, 8)));
	}

	@Test(expected = InternalCompilerError.class)
	public void testUnknownConsumesIsInternalError() {
		expanding(stitch(Stitch.KNIT)).getConsumes();
	}

	@Test
	public void testRowsChainFromFirstToLast() {
		Pattern p = pattern(
				row(fixed(4, stitch(Stitch.CAST_ON))),
				row(fixed(4, stitch(Stitch.KNIT))),
				row(fixed(2, stitch(Stitch.KNIT2TOG))));
		assertThat(p.getCounts(), is(new StitchCounts(0, 2)));
		assertThat(rows(3, row(stitch(Stitch.KNIT)), row(stitch(Stitch.KNIT_FRONT_BACK))).getCounts(),
				is(new StitchCounts(1, 2)));
	}

	@Test
	public void testBlockSumsSiblings() {
		Block b = block(
				pattern(row(fixed(2, stitch(Stitch.KNIT)))),
				pattern(row(fixed(3, stitch(Stitch.PURL)))));
		assertThat(b.getCounts(), is(new StitchCounts(5, 5)));
		assertThat(blockRepeat(2, b).getCounts(), is(new StitchCounts(10, 10)));
	}

	@Test
	public void testSideAlternates() {
		Iterator<Side> sides = Side.WRONG.alternate();
		assertThat(sides.next(), is(Side.WRONG));
		assertThat(sides.next(), is(Side.RIGHT));
		assertThat(sides.next(), is(Side.WRONG));
		assertThat(Side.fromSymbol("RS"), is(Side.RIGHT));
	}

	@Test
	public void testPatternIdentityIgnoresEnvironmentAndName() {
		Pattern p = pattern(row(stitch(Stitch.KNIT)));
		assertThat(p.withName("garter").withEnv(java.util.Collections.emptyMap()), is(p));
	}

}
