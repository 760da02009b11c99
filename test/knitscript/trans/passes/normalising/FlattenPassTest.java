package knitscript.trans.passes.normalising;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static knitscript.model.KnitBuilder.*;

import knitscript.model.*;
import knitscript.trans.passes.inference.RowCounter;
import org.junit.Test;

public class FlattenPassTest {

	private static final StitchLit K = stitch(Stitch.KNIT);
	private static final StitchLit P = stitch(Stitch.PURL);

	@Test
	public void testNestedStructureIsFlattened() {
		Pattern nested = pattern(
				row(fixed(2, fixed(3, K, P))),
				rows(1, row(K)),
				pattern(row(P)));
		Node flat = FlattenPass.perform(nested);
		assertThat(flat, is(pattern(row(fixed(6, K, P)), row(K), row(P))));
	}

	@Test
	public void testFlatteningIsIdempotent() {
		Pattern nested = pattern(
				row(fixed(1, K, fixed(1, P)), fixed(2, fixed(2, K))),
				rows(3, row(K), row(P)));
		Node once = FlattenPass.perform(nested);
		assertThat(FlattenPass.perform(once), is(once));
	}

	@Test
	public void testRowRepeatsKeptUnlessUnrolling() {
		Pattern p = pattern(rows(3, row(Side.RIGHT, K), row(Side.WRONG, P)));
		assertThat(FlattenPass.perform(p), is(p));
		Pattern unrolled = (Pattern) FlattenPass.perform(p, true);
		assertThat(unrolled.getRows().size(), is(6));
	}

	@Test
	public void testBlockSiblingsMergeIntoOneRow() {
		Node merged = FlattenPass.perform(block(
				pattern(row(Side.RIGHT, fixed(2, K))),
				pattern(row(Side.RIGHT, fixed(3, P)))));
		// right side rows are worked from right to left, so the last sibling comes first
		assertThat(merged, is(pattern(row(Side.RIGHT, fixed(3, P), fixed(2, K)))));
	}

	@Test
	public void testBlockRepeatRepeatsAcross() {
		Node merged = FlattenPass.perform(blockRepeat(3, block(pattern(row(Side.WRONG, K, P)))));
		assertThat(merged, is(pattern(row(Side.WRONG, fixed(3, K, P)))));
	}

	@Test
	public void testBlockOfUnevenHeightsCoversTallest() {
		Node merged = FlattenPass.perform(block(
				pattern(rows(3, row(Side.RIGHT, K), row(Side.WRONG, K))),
				pattern(row(Side.RIGHT, P), row(Side.WRONG, P))));
		assertThat(RowCounter.count(merged), is(6));
	}

}
