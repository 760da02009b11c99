package knitscript.model;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class StitchTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{ Stitch.CAST_ON, "CO", 0, 1, Stitch.CAST_ON },
				{ Stitch.BIND_OFF, "BO", 1, 0, Stitch.BIND_OFF },
				{ Stitch.KNIT, "K", 1, 1, Stitch.PURL },
				{ Stitch.PURL, "P", 1, 1, Stitch.KNIT },
				{ Stitch.SLIP, "SL", 1, 1, Stitch.SLIP },
				{ Stitch.PSSO, "PSSO", 0, -1, null },
				{ Stitch.YARN_OVER, "YO", 0, 1, Stitch.YARN_OVER },
				{ Stitch.KNIT2TOG, "K2TOG", 2, 1, Stitch.SLIP_SLIP_PURL },
				{ Stitch.PURL2TOG, "P2TOG", 2, 1, Stitch.SLIP_SLIP_KNIT },
				{ Stitch.SLIP_SLIP_KNIT, "SSK", 2, 1, Stitch.PURL2TOG },
				{ Stitch.SLIP_SLIP_PURL, "SSP", 2, 1, Stitch.KNIT2TOG },
				{ Stitch.KNIT_FRONT_BACK, "KFB", 1, 2, Stitch.PURL_FRONT_BACK },
				{ Stitch.PURL_FRONT_BACK, "PFB", 1, 2, Stitch.KNIT_FRONT_BACK },
				{ Stitch.MAKE_ONE, "M1", 0, 1, Stitch.MAKE_ONE_PURL },
				{ Stitch.MAKE_ONE_PURL, "M1P", 0, 1, Stitch.MAKE_ONE },
		});
	}

	private final Stitch stitch;
	private final String symbol;
	private final int consumes;
	private final int produces;
	private final Stitch reverse;

	public StitchTest(Stitch stitch, String symbol, int consumes, int produces, Stitch reverse) {
		this.stitch = stitch;
		this.symbol = symbol;
		this.consumes = consumes;
		this.produces = produces;
		this.reverse = reverse;
	}

	@Test
	public void testCounts() {
		assertThat(stitch.getSymbol(), is(symbol));
		assertThat(stitch.getConsumes(), is(consumes));
		assertThat(stitch.getProduces(), is(produces));
	}

	@Test
	public void testLookupBySymbol() {
		assertThat(Stitch.fromSymbol(symbol), is(Optional.of(stitch)));
	}

	@Test
	public void testReverse() {
		assertThat(stitch.getReverse(), is(Optional.ofNullable(reverse)));
		if (reverse != null) {
			// reversing twice gives back the same stitch, and the counts never change
			assertThat(reverse.getReverse(), is(Optional.of(stitch)));
			assertThat(reverse.getConsumes(), is(consumes));
			assertThat(reverse.getProduces(), is(produces));
		}
	}

}
