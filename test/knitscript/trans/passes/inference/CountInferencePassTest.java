package knitscript.trans.passes.inference;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static knitscript.model.KnitBuilder.*;

import knitscript.model.*;
import org.junit.Test;

public class CountInferencePassTest {

	@Test
	public void testExpandingRepeatFillsRow() {
		Pattern p = (Pattern) CountInferencePass.perform(
				pattern(row(fixed(6, stitch(Stitch.CAST_ON))), row(expanding(stitch(Stitch.KNIT), stitch(Stitch.PURL)))),
				null);
		Row second = (Row) p.getRows().get(1);
		assertThat(((ExpandingStitchRepeat) second.getStitches().get(0)).getTimes(), is(3));
		assertThat(second.getConsumes(), is(6));
		assertThat(p.getProduces(), is(6));
	}

	@Test
	public void testToLastLeavesStitchesForLaterSiblings() {
		Row r = (Row) CountInferencePass.perform(
				row(expanding(2, stitch(Stitch.KNIT)), stitch(Stitch.PURL), stitch(Stitch.PURL)), 7);
		assertThat(((ExpandingStitchRepeat) r.getStitches().get(0)).getTimes(), is(5));
		assertThat(r.getConsumes(), is(7));
	}

	@Test
	public void testUnevenRepeatIsRoundedDown() {
		Row r = (Row) CountInferencePass.perform(row(expanding(stitch(Stitch.KNIT2TOG))), 5);
		assertThat(((ExpandingStitchRepeat) r.getStitches().get(0)).getTimes(), is(2));
	}

	@Test(expected = AmbiguousRepeatIssue.class)
	public void testExpandingRepeatWithUnknownWidth() {
		CountInferencePass.perform(pattern(row(expanding(stitch(Stitch.KNIT)))), null);
	}

	@Test(expected = AmbiguousRepeatIssue.class)
	public void testExpandingRepeatThatConsumesNothing() {
		CountInferencePass.perform(row(expanding(stitch(Stitch.YARN_OVER))), 4);
	}

	@Test
	public void testRowRepeatThreadsCountsThroughRepetitions() {
		// the increase row runs twice, so only the first iteration's counts are kept
		Pattern p = (Pattern) CountInferencePass.perform(pattern(
				row(fixed(2, stitch(Stitch.CAST_ON))),
				rows(2, row(expanding(stitch(Stitch.KNIT_FRONT_BACK))))), null);
		RowRepeat rep = (RowRepeat) p.getRows().get(1);
		assertThat(((ExpandingStitchRepeat) ((Row) rep.getRows().get(0)).getStitches().get(0)).getTimes(), is(2));
	}

	@Test
	public void testRowCounter() {
		assertThat(RowCounter.count(row(stitch(Stitch.KNIT))), is(1));
		assertThat(RowCounter.count(rows(3, row(stitch(Stitch.KNIT)), row(stitch(Stitch.PURL)))), is(6));
		assertThat(RowCounter.count(block(
				pattern(row(stitch(Stitch.KNIT))),
				pattern(row(stitch(Stitch.KNIT)), row(stitch(Stitch.PURL))))), is(2));
	}

}
