package knitscript.trans.passes.inference;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static knitscript.model.KnitBuilder.*;

import knitscript.model.*;
import org.junit.Test;

public class SideInferencePassTest {

	private static Side sideOf(Node row) {
		return ((Row) row).getSide();
	}

	@Test
	public void testPatternStartsOnRightSide() {
		Pattern p = (Pattern) SideInferencePass.perform(
				pattern(row(stitch(Stitch.KNIT)), row(stitch(Stitch.PURL)), row(stitch(Stitch.KNIT))),
				Side.RIGHT);
		assertThat(sideOf(p.getRows().get(0)), is(Side.RIGHT));
		assertThat(sideOf(p.getRows().get(1)), is(Side.WRONG));
		assertThat(sideOf(p.getRows().get(2)), is(Side.RIGHT));
		assertTrue(((Row) p.getRows().get(0)).isInferred());
	}

	@Test
	public void testCastOnRowIsWrongSide() {
		Pattern p = pattern(row(fixed(3, stitch(Stitch.CAST_ON))), row(expanding(stitch(Stitch.KNIT))));
		assertThat(SideInferencePass.startingSide(p), is(Side.WRONG));
		Pattern sided = (Pattern) SideInferencePass.perform(p, Side.RIGHT);
		assertThat(sideOf(sided.getRows().get(0)), is(Side.WRONG));
		assertThat(sideOf(sided.getRows().get(1)), is(Side.RIGHT));
	}

	@Test
	public void testMixedRowIsNotACastOnRow() {
		Pattern p = pattern(row(stitch(Stitch.CAST_ON), stitch(Stitch.KNIT)));
		assertThat(SideInferencePass.startingSide(p), is(Side.RIGHT));
	}

	@Test
	public void testExplicitSideIsKept() {
		Pattern p = (Pattern) SideInferencePass.perform(
				pattern(row(Side.WRONG, stitch(Stitch.KNIT)), row(stitch(Stitch.PURL))), Side.RIGHT);
		assertThat(sideOf(p.getRows().get(0)), is(Side.WRONG));
		assertFalse(((Row) p.getRows().get(0)).isInferred());
		assertThat(sideOf(p.getRows().get(1)), is(Side.WRONG));
	}

	@Test
	public void testRowRepeatAlternatesWithin() {
		RowRepeat rep = (RowRepeat) SideInferencePass.perform(
				rows(2, row(stitch(Stitch.KNIT)), row(stitch(Stitch.PURL))), Side.WRONG);
		assertThat(sideOf(rep.getRows().get(0)), is(Side.WRONG));
		assertThat(sideOf(rep.getRows().get(1)), is(Side.RIGHT));
	}

	@Test
	public void testBlockSiblingsShareSide() {
		Block b = (Block) SideInferencePass.perform(
				block(pattern(row(stitch(Stitch.KNIT))), pattern(row(stitch(Stitch.PURL)))), Side.RIGHT);
		for (Node sibling : b.getPatterns()) {
			assertThat(sideOf(((Pattern) sibling).getRows().get(0)), is(Side.RIGHT));
		}
	}

}
