package knitscript.trans.passes.reversal;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static knitscript.model.KnitBuilder.*;

import knitscript.model.*;
import org.junit.Test;

public class ReversalPassTest {

	@Test
	public void testReversedRowIsMirroredAndTranslated() {
		Row r = row(Side.RIGHT, stitch(Stitch.KNIT), stitch(Stitch.PURL), stitch(Stitch.KNIT2TOG));
		Node reversed = ReversalPass.perform(r, 0);
		assertThat(reversed, is(row(Side.WRONG,
				stitch(Stitch.SLIP_SLIP_PURL), stitch(Stitch.KNIT), stitch(Stitch.PURL))));
	}

	@Test
	public void testReversalIsAnInvolution() {
		Row r = row(Side.WRONG,
				stitch(Stitch.YARN_OVER),
				fixed(2, stitch(Stitch.SLIP_SLIP_KNIT), stitch(Stitch.KNIT_FRONT_BACK)),
				stitch(Stitch.MAKE_ONE));
		assertThat(ReversalPass.perform(ReversalPass.perform(r, 0), 0), is(r));
	}

	@Test
	public void testExpandingRepeatKeepsItsPlace() {
		Row r = row(Side.RIGHT,
				stitch(Stitch.KNIT),
				expanding(2, stitch(Stitch.PURL)).withTimes(3),
				stitch(Stitch.KNIT),
				stitch(Stitch.KNIT));
		Row reversed = (Row) ReversalPass.perform(r, 0);
		// one stitch was worked before the repeat, so one is left after it once reversed
		ExpandingStitchRepeat rep = (ExpandingStitchRepeat) reversed.getStitches().get(2);
		assertThat(rep.getToLast(), is(nat(1)));
		assertThat(ReversalPass.perform(reversed, 0), is(r));
	}

	@Test
	public void testExpandingRepeatInsideFixedRepeat() {
		Row r = row(Side.WRONG,
				stitch(Stitch.KNIT),
				stitch(Stitch.KNIT),
				fixed(1, expanding(1, stitch(Stitch.PURL)).withTimes(2)),
				stitch(Stitch.KNIT));
		Row reversed = (Row) ReversalPass.perform(r, 0);
		FixedStitchRepeat group = (FixedStitchRepeat) reversed.getStitches().get(1);
		// two stitches were worked before the group, so two remain after it when turned
		assertThat(((ExpandingStitchRepeat) group.getStitches().get(0)).getToLast(), is(nat(2)));
		assertThat(ReversalPass.perform(reversed, 0), is(r));
	}

	@Test(expected = IrreversibleStitchIssue.class)
	public void testPassOverCannotBeReversed() {
		ReversalPass.perform(row(Side.RIGHT,
				stitch(Stitch.SLIP), stitch(Stitch.KNIT), stitch(Stitch.PSSO)), 0);
	}

}
