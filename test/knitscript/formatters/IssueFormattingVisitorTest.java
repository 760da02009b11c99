package knitscript.formatters;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static knitscript.model.KnitBuilder.*;

import knitscript.model.Stitch;
import knitscript.model.StitchLit;
import knitscript.modules.CircularModuleReferenceIssue;
import knitscript.trans.passes.reversal.IrreversibleStitchIssue;
import knitscript.trans.passes.validation.TooFewStitchesIssue;
import knitscript.trans.passes.validation.TooManyStitchesIssue;
import knitscript.util.SourceLocation;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.Arrays;

public class IssueFormattingVisitorTest {

	@Test
	public void testNodeWithoutLocationIsShownInline() {
		TooFewStitchesIssue issue = new TooFewStitchesIssue(fixed(5, stitch(Stitch.KNIT)), 5, 0);
		assertThat(issue.getMessage(), startsWith("expected 5 stitches, but none are available in "));
	}

	@Test
	public void testNodeWithLocationPointsAtSource() {
		SourceLocation loc = new SourceLocation(Paths.get("scarf.ks"), 10, 14, 2, 2, 4, 8);
		StitchLit psso = new StitchLit(loc, Stitch.PSSO);
		IrreversibleStitchIssue issue = new IrreversibleStitchIssue(psso);
		assertThat(issue.getMessage(), is("cannot reverse stitch PSSO " + loc.prettyString()));
	}

	@Test
	public void testPhaseIsNamed() {
		TooManyStitchesIssue issue = new TooManyStitchesIssue(
				pattern(row(fixed(3, stitch(Stitch.CAST_ON)))), 3, TooManyStitchesIssue.Phase.BIND_OFF);
		assertThat(issue.getMessage(), startsWith("expected 3 stitches to be bound off"));
	}

	@Test
	public void testCircularChain() {
		CircularModuleReferenceIssue issue = new CircularModuleReferenceIssue(Arrays.asList("a", "b", "a"));
		assertThat(issue.getMessage(), is("circular module reference: a -> b -> a"));
	}

}
