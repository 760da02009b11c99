package knitscript.model;

import knitscript.util.SourceLocation;

public class StitchLit extends Knittable {
	private final Stitch stitch;

	public StitchLit(SourceLocation location, Stitch stitch) {
		super(location);
		this.stitch = stitch;
	}

	public Stitch getStitch() {
		return stitch;
	}

	@Override
	protected StitchCounts deriveCounts() {
		return new StitchCounts(stitch.getConsumes(), stitch.getProduces());
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return stitch.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		return stitch == ((StitchLit) obj).stitch;
	}
}
