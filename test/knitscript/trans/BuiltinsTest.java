package knitscript.trans;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static knitscript.model.KnitBuilder.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;

import knitscript.model.*;
import org.junit.Before;
import org.junit.Test;

public class BuiltinsTest {

	private static final StitchLit K = stitch(Stitch.KNIT);
	private static final StitchLit P = stitch(Stitch.PURL);
	private static final String NL = System.lineSeparator();

	private ByteArrayOutputStream bytes;
	private Map<String, Node> env;

	@Before
	public void setUp() {
		bytes = new ByteArrayOutputStream();
		env = Builtins.defaultEnvironment(new PrintStream(bytes, true));
	}

	private String output() {
		return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
	}

	private Node apply(String name, Node... args) {
		return ((NativeFunction) env.get(name)).apply(Arrays.asList(args));
	}

	private static Pattern swatch() {
		return pattern(row(fixed(2, K)), row(fixed(2, P)));
	}

	private static Pattern cast(int n, Node middle) {
		return pattern(
				row(fixed(n, stitch(Stitch.CAST_ON))),
				middle,
				row(fixed(n, stitch(Stitch.BIND_OFF))));
	}

	@Test
	public void testEnvironmentHasEveryBuiltin() {
		assertEquals(new HashSet<>(Arrays.asList("reflect", "show", "note", "fill", "width", "height")),
				env.keySet());
	}

	@Test
	public void testReflectMirrorsStitchOrder() {
		assertThat(apply("reflect", row(fixed(2, K, P), K)), is(row(K, fixed(2, P, K))));
	}

	@Test
	public void testReflectKeepsRowOrder() {
		Node reflected = Builtins.reflect(pattern(row(K, P), row(P, P, K)));
		assertThat(reflected, is(pattern(row(P, K), row(K, P, P))));
	}

	@Test
	public void testWidthAndHeight() {
		Pattern p = cast(3, row(fixed(3, K)));
		assertThat(apply("width", p), is(nat(3)));
		assertThat(apply("height", p), is(nat(3)));
	}

	@Test
	public void testFillTilesAcrossAndUp() {
		Pattern filled = (Pattern) apply("fill", swatch(), nat(6), nat(4));
		assertThat(filled.getRows().size(), is(1));
		RowRepeat up = (RowRepeat) filled.getRows().get(0);
		assertThat(up.getTimes(), is(nat(2)));
		FixedBlockRepeat across = (FixedBlockRepeat) up.getRows().get(0);
		assertThat(across.getTimes(), is(nat(3)));
		assertThat(((Block) across.getBlock()).getPatterns(), is(Collections.singletonList((Node) swatch())));
	}

	@Test
	public void testFillMustDivideEvenly() {
		try {
			Builtins.fill(swatch(), 5, 4);
			fail("expected NonEvenFillIssue");
		} catch (NonEvenFillIssue issue) {
			assertThat(issue.getPatternWidth(), is(2));
			assertThat(issue.getPatternHeight(), is(2));
			assertThat(issue.getWidth(), is(5));
			assertThat(issue.getMessage(), startsWith("2x2 pattern does not fit evenly into 5x4 fill box"));
		}
	}

	@Test(expected = NonEvenFillIssue.class)
	public void testFillBoxSmallerThanPattern() {
		Builtins.fill(swatch(), 2, 1);
	}

	@Test
	public void testArgumentsAreTypeChecked() {
		try {
			apply("fill", swatch(), str("wide"), nat(2));
			fail("expected ArgumentTypeIssue");
		} catch (ArgumentTypeIssue issue) {
			assertThat(issue.getFunctionName(), is("fill"));
			assertThat(issue.getPosition(), is(1));
			assertThat(issue.getMessage(), startsWith("argument 2 of fill must be a natural number"));
		}
	}

	@Test(expected = ArgumentTypeIssue.class)
	public void testParameterizedPatternHasNoWidth() {
		apply("width", pattern(Collections.singletonList("n"), row(fixed(ref("n"), K))));
	}

	@Test
	public void testShowPrintsInstructions() {
		Node result = apply("show", cast(3, row(fixed(3, K))), str("Swatch"));
		assertThat(result, is(nullValue()));
		assertThat(output(), is(NL + "Swatch" + NL + NL + "CO 3.\nK 3.\nBO 3." + NL + NL));
	}

	@Test
	public void testShowPrintsIssues() {
		apply("show", cast(4, row(fixed(5, K))));
		assertThat(output(), containsString("error: expected 5 stitches, but only 4 are available"));
	}

	@Test
	public void testShowWithoutOutputDoesNothing() {
		Map<String, Node> silent = Builtins.defaultEnvironment(null);
		Node result = ((NativeFunction) silent.get("show")).apply(
				Collections.singletonList((Node) cast(3, row(fixed(3, K)))));
		assertThat(result, is(nullValue()));
	}

	@Test
	public void testNotePrintsText() {
		apply("note", str("mind the gap"));
		assertThat(output(), is("mind the gap" + NL));
	}

}
