package knitscript.trans.passes.reversal;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static knitscript.model.KnitBuilder.*;

import knitscript.model.*;
import org.junit.Test;

public class AlternationPassTest {

	private static final StitchLit K = stitch(Stitch.KNIT);
	private static final StitchLit P = stitch(Stitch.PURL);

	@Test
	public void testRowsOnTheWrongSideAreReversed() {
		Node alternated = AlternationPass.perform(
				pattern(row(Side.RIGHT, K, P), row(Side.RIGHT, K, K)), Side.RIGHT);
		assertThat(alternated, is(pattern(row(Side.RIGHT, K, P), row(Side.WRONG, P, P))));
	}

	@Test
	public void testRowsAlreadyAlternatingAreKept() {
		Pattern p = pattern(row(Side.WRONG, K), row(Side.RIGHT, P), row(Side.WRONG, K));
		assertThat(AlternationPass.perform(p, Side.WRONG), is(p));
	}

	@Test
	public void testOddRepeatFlipsFollowingRow() {
		// the repeat spans three rows, so the row after it starts on the other side
		Node alternated = AlternationPass.perform(pattern(
				rows(3, row(Side.RIGHT, K)),
				row(Side.RIGHT, K)), Side.RIGHT);
		Pattern p = (Pattern) alternated;
		assertThat(p.getRows().get(1), is(row(Side.WRONG, P)));
	}

}
