package knitscript.trans.passes.normalising;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static knitscript.model.KnitBuilder.*;

import java.util.Arrays;
import java.util.List;

import knitscript.model.*;
import knitscript.trans.passes.inference.RowCounter;
import org.junit.Test;

public class MergeAcrossPassTest {

	private static final StitchLit K = stitch(Stitch.KNIT);
	private static final StitchLit P = stitch(Stitch.PURL);

	private static RowRepeat twoRows(int times, StitchLit s) {
		return rows(times, row(Side.RIGHT, fixed(2, s)), row(Side.WRONG, fixed(2, s)));
	}

	@Test
	public void testRepeatsMergeOverCommonPeriod() {
		RowRepeat three = twoRows(3, K);
		RowRepeat one = twoRows(1, P);
		RowRepeat merged = (RowRepeat) MergeAcrossPass.perform(Arrays.asList(three, one));

		assertThat(merged.getRows().size(), is(2));
		assertThat(merged.getTimes(), is(nat(3)));
		int total = RowCounter.count(merged);
		// both inputs fit into the merged repeat a whole number of times
		assertThat(total % RowCounter.count(three), is(0));
		assertThat(total % RowCounter.count(one), is(0));
	}

	@Test
	public void testMergedRowCountDoesNotDependOnOrder() {
		RowRepeat a = rows(2, row(Side.RIGHT, K), row(Side.WRONG, K), row(Side.RIGHT, K));
		RowRepeat b = twoRows(2, P);
		int ab = RowCounter.count(MergeAcrossPass.perform(Arrays.asList(a, b)));
		int ba = RowCounter.count(MergeAcrossPass.perform(Arrays.asList(b, a)));
		assertThat(ab, is(ba));
		assertTrue(ab >= 6);
	}

	@Test
	public void testWrongSideRowsReadLeftToRight() {
		Row merged = (Row) MergeAcrossPass.perform(Arrays.asList(
				row(Side.WRONG, fixed(2, K)), row(Side.WRONG, fixed(3, P))));
		assertThat(merged, is(row(Side.WRONG, fixed(2, K), fixed(3, P))));
	}

	@Test
	public void testOppositeSideSiblingIsReversed() {
		Row merged = (Row) MergeAcrossPass.perform(Arrays.asList(
				row(Side.WRONG, fixed(2, K)), row(Side.RIGHT, fixed(3, K))));
		assertThat(merged, is(row(Side.WRONG, fixed(2, K), fixed(3, P))));
	}

	@Test
	public void testExpandingRepeatStopsShortOfLaterSiblings() {
		Row merged = (Row) MergeAcrossPass.perform(Arrays.asList(
				row(Side.WRONG, expanding(K).withTimes(4)), row(Side.WRONG, fixed(3, P))));
		ExpandingStitchRepeat first = (ExpandingStitchRepeat) merged.getStitches().get(0);
		assertThat(first.getToLast(), is(nat(3)));
	}

	@Test
	public void testRowNextToRepeatUnrollsEverything() {
		Pattern a = pattern(row(Side.RIGHT, K), rows(2, row(Side.WRONG, K), row(Side.RIGHT, K)));
		Pattern b = pattern(rows(2, row(Side.RIGHT, P), row(Side.WRONG, P)), row(Side.RIGHT, P));
		Pattern merged = (Pattern) MergeAcrossPass.perform(Arrays.asList(a, b));
		for (Node row : merged.getRows()) {
			assertThat(row, instanceOf(Row.class));
		}
		assertThat(merged.getRows().size(), is(5));
	}

	@Test
	public void testRepeatRowsReinfersOddSequences() {
		List<Node> repeated = MergeAcrossPass.repeatRows(
				Arrays.asList(row(stitch(Stitch.KNIT)).withSide(Side.RIGHT, true)), 3);
		assertThat(((Row) repeated.get(0)).getSide(), is(Side.RIGHT));
		assertThat(((Row) repeated.get(1)).getSide(), is(Side.WRONG));
		assertThat(((Row) repeated.get(2)).getSide(), is(Side.RIGHT));
	}

}
