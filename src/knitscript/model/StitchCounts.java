package knitscript.model;

/**
 * The number of stitches a knittable node takes from the current row and leaves for the next one.
 */
public final class StitchCounts {
	public static final StitchCounts ZERO = new StitchCounts(0, 0);

	private final int consumes;
	private final int produces;

	public StitchCounts(int consumes, int produces) {
		this.consumes = consumes;
		this.produces = produces;
	}

	public int getConsumes() {
		return consumes;
	}

	public int getProduces() {
		return produces;
	}

	public StitchCounts plus(StitchCounts other) {
		return new StitchCounts(consumes + other.consumes, produces + other.produces);
	}

	public StitchCounts times(int n) {
		return new StitchCounts(consumes * n, produces * n);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		StitchCounts that = (StitchCounts) o;
		return consumes == that.consumes && produces == that.produces;
	}

	@Override
	public int hashCode() {
		return 31 * consumes + produces;
	}

	@Override
	public String toString() {
		return "StitchCounts [consumes=" + consumes + ", produces=" + produces + "]";
	}
}
