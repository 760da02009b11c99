package knitscript.formatters;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static knitscript.model.KnitBuilder.*;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

import knitscript.model.Node;
import knitscript.model.Side;
import knitscript.model.Stitch;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class InstructionFormattingVisitorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{
						stitch(Stitch.SLIP_SLIP_KNIT),
						"SSK",
				},
				{
						fixed(1, stitch(Stitch.KNIT)),
						"K",
				},
				{
						fixed(3, stitch(Stitch.KNIT)),
						"K 3",
				},
				{
						fixed(2, stitch(Stitch.KNIT), stitch(Stitch.PURL)),
						"[K, P] 2",
				},
				{
						fixed(1, stitch(Stitch.KNIT), stitch(Stitch.PURL)),
						"K, P",
				},
				{
						fixed(2, fixed(2, stitch(Stitch.KNIT)), stitch(Stitch.YARN_OVER)),
						"[K 2, YO] 2",
				},
				{
						expanding(stitch(Stitch.KNIT), stitch(Stitch.PURL)),
						"*K, P; rep from * to end",
				},
				{
						expanding(2, stitch(Stitch.KNIT)),
						"*K; rep from * to last 2",
				},
				{
						row(stitch(Stitch.SLIP), stitch(Stitch.KNIT), stitch(Stitch.PSSO)),
						"SL, K, PSSO",
				},
				{
						pattern(
								row(fixed(4, stitch(Stitch.CAST_ON))),
								rows(4,
										row(fixed(2, stitch(Stitch.KNIT), stitch(Stitch.PURL))),
										row(fixed(2, stitch(Stitch.KNIT), stitch(Stitch.PURL)))),
								row(fixed(4, stitch(Stitch.BIND_OFF)))),
						"CO 4.\n" +
								"**\n" +
								"[K, P] 2.\n" +
								"[K, P] 2.\n" +
								"rep from ** 4 times.\n" +
								"BO 4.",
				},
				{
						pattern(
								row(fixed(3, stitch(Stitch.CAST_ON))),
								rows(1, row(fixed(3, stitch(Stitch.KNIT)))),
								row(fixed(3, stitch(Stitch.BIND_OFF)))),
						"CO 3.\nK 3.\nBO 3.",
				},
				{
						pattern(
								row(fixed(2, stitch(Stitch.CAST_ON))),
								pattern(row(fixed(2, stitch(Stitch.KNIT))), row(fixed(2, stitch(Stitch.PURL)))),
								row(fixed(2, stitch(Stitch.BIND_OFF)))),
						"CO 2.\nK 2.\nP 2.\nBO 2.",
				},
		});
	}

	private final Node node;
	private final String expected;

	public InstructionFormattingVisitorTest(Node node, String expected) {
		this.node = node;
		this.expected = expected;
	}

	static String render(Node node, boolean annotateRows) throws IOException {
		StringWriter sw = new StringWriter();
		node.accept(new InstructionFormattingVisitor(new IndentingWriter(sw, "\n"), annotateRows));
		return sw.toString();
	}

	@Test
	public void test() throws IOException {
		assertThat(render(node, false), is(expected));
	}

	@Test
	public void testAnnotatedRowsShowSideAndWidth() throws IOException {
		Node annotated = pattern(
				row(Side.WRONG, fixed(3, stitch(Stitch.CAST_ON))),
				row(Side.RIGHT, stitch(Stitch.KNIT_FRONT_BACK), fixed(2, stitch(Stitch.KNIT))),
				row(Side.WRONG, fixed(4, stitch(Stitch.BIND_OFF))));
		assertThat(render(annotated, true), is(
				"WS: CO 3. (3 sts)\n" +
						"RS: KFB, K 2. (4 sts)\n" +
						"WS: BO 4. (0 sts)"));
	}

}
