package knitscript;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import org.junit.Before;
import org.junit.Test;

public class KnitScriptMainTest {

	private ByteArrayOutputStream out;
	private ByteArrayOutputStream err;

	@Before
	public void setUp() {
		out = new ByteArrayOutputStream();
		err = new ByteArrayOutputStream();
	}

	private boolean run(String... args) {
		return new KnitScriptMain(args, new PrintStream(out, true), new PrintStream(err, true)).run();
	}

	private static String text(ByteArrayOutputStream bytes) {
		return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
	}

	private static String document(String name) {
		return Paths.get("test", "patterns", name).toString();
	}

	@Test
	public void testVersion() {
		assertTrue(run("--version"));
		assertThat(text(out), containsString("KnitScript version " + KnitScriptOptions.VERSION));
	}

	@Test
	public void testRendersEveryPattern() {
		assertTrue(run("-q", document("scarf.json")));
		assertThat(text(out), containsString("scarf:"));
		assertThat(text(out), containsString("CO 4.\n[K, P] 2.\nBO 4."));
		assertThat(text(err), is(""));
	}

	@Test
	public void testUnpreparablePattern() {
		// garter starts without casting on, so its repeats cannot be counted
		assertFalse(run("-q", document("stitches.json")));
		assertThat(text(err), containsString("garter: ambiguous use of expanding stitch repeat"));
	}

	@Test
	public void testUnknownPatternName() {
		assertFalse(run("-q", "-p", "rib", document("scarf.json")));
		assertThat(text(err), containsString("no pattern without parameters named \"rib\""));
	}

	@Test
	public void testMissingModule() {
		assertFalse(run("-q", document("missing_module.json")));
		assertThat(text(err), containsString("error loading module \"nowhere\""));
	}

	@Test
	public void testMissingDocument() {
		assertFalse(run("-q"));
		assertThat(text(err), containsString("expected exactly one document"));
	}

}
