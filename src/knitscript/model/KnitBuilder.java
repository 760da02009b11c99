package knitscript.model;

import knitscript.util.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Shorthand constructors for building trees in code, all with unknown source locations.
 */
public class KnitBuilder {
	private KnitBuilder() {}

	public static NaturalLit nat(int value) {
		return new NaturalLit(SourceLocation.unknown(), value);
	}

	public static StringLit str(String value) {
		return new StringLit(SourceLocation.unknown(), value);
	}

	public static StitchLit stitch(Stitch stitch) {
		return new StitchLit(SourceLocation.unknown(), stitch);
	}

	public static FixedStitchRepeat fixed(int times, Node... stitches) {
		return new FixedStitchRepeat(SourceLocation.unknown(), Arrays.asList(stitches), nat(times));
	}

	public static FixedStitchRepeat fixed(Node times, Node... stitches) {
		return new FixedStitchRepeat(SourceLocation.unknown(), Arrays.asList(stitches), times);
	}

	public static ExpandingStitchRepeat expanding(int toLast, Node... stitches) {
		return new ExpandingStitchRepeat(SourceLocation.unknown(), Arrays.asList(stitches), nat(toLast));
	}

	public static ExpandingStitchRepeat expanding(Node... stitches) {
		return expanding(0, stitches);
	}

	public static Row row(Node... stitches) {
		return new Row(SourceLocation.unknown(), Arrays.asList(stitches), null, false);
	}

	public static Row row(Side side, Node... stitches) {
		return new Row(SourceLocation.unknown(), Arrays.asList(stitches), side, false);
	}

	public static RowRepeat rows(int times, Node... rows) {
		return new RowRepeat(SourceLocation.unknown(), Arrays.asList(rows), nat(times));
	}

	public static Pattern pattern(Node... rows) {
		return new Pattern(SourceLocation.unknown(), Arrays.asList(rows), Collections.emptyList(), null);
	}

	public static Pattern pattern(List<String> params, Node... rows) {
		return new Pattern(SourceLocation.unknown(), Arrays.asList(rows), params, null);
	}

	public static Block block(Node... patterns) {
		return new Block(SourceLocation.unknown(), Arrays.asList(patterns));
	}

	public static FixedBlockRepeat blockRepeat(int times, Node block) {
		return new FixedBlockRepeat(SourceLocation.unknown(), block, nat(times));
	}

	public static VarRef ref(String name) {
		return new VarRef(SourceLocation.unknown(), name);
	}

	public static Call call(Node target, Node... args) {
		return new Call(SourceLocation.unknown(), target, Arrays.asList(args));
	}

	public static Call call(String name, Node... args) {
		return call(ref(name), args);
	}
}
