package knitscript.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The catalog of atomic stitch kinds.
 *
 * Each kind knows how many stitches it takes from the current row and how many it leaves on the
 * needle for the next row. PSSO produces -1: it lifts a stitch that an earlier slip already put
 * on the right needle over the one just worked, removing it.
 */
public enum Stitch {
	CAST_ON("CO", 0, 1, "CAST_ON"),
	BIND_OFF("BO", 1, 0, "BIND_OFF"),
	KNIT("K", 1, 1, "PURL"),
	PURL("P", 1, 1, "KNIT"),
	SLIP("SL", 1, 1, "SLIP"),
	PSSO("PSSO", 0, -1, null),
	YARN_OVER("YO", 0, 1, "YARN_OVER"),
	KNIT2TOG("K2TOG", 2, 1, "SLIP_SLIP_PURL"),
	PURL2TOG("P2TOG", 2, 1, "SLIP_SLIP_KNIT"),
	SLIP_SLIP_KNIT("SSK", 2, 1, "PURL2TOG"),
	SLIP_SLIP_PURL("SSP", 2, 1, "KNIT2TOG"),
	KNIT_FRONT_BACK("KFB", 1, 2, "PURL_FRONT_BACK"),
	PURL_FRONT_BACK("PFB", 1, 2, "KNIT_FRONT_BACK"),
	MAKE_ONE("M1", 0, 1, "MAKE_ONE_PURL"),
	MAKE_ONE_PURL("M1P", 0, 1, "MAKE_ONE");

	private static final Map<String, Stitch> bySymbol = new HashMap<>();

	static {
		for (Stitch stitch : values()) {
			bySymbol.put(stitch.symbol, stitch);
		}
	}

	private final String symbol;
	private final int consumes;
	private final int produces;
	// by name, since the reverse may not have been constructed yet
	private final String reverse;

	Stitch(String symbol, int consumes, int produces, String reverse) {
		this.symbol = symbol;
		this.consumes = consumes;
		this.produces = produces;
		this.reverse = reverse;
	}

	public String getSymbol() {
		return symbol;
	}

	public int getConsumes() {
		return consumes;
	}

	public int getProduces() {
		return produces;
	}

	/**
	 * @return the stitch that has the same effect when the fabric is worked from the other side,
	 * or empty if there is none
	 */
	public Optional<Stitch> getReverse() {
		if (reverse == null) {
			return Optional.empty();
		}
		return Optional.of(Stitch.valueOf(reverse));
	}

	public static Optional<Stitch> fromSymbol(String symbol) {
		return Optional.ofNullable(bySymbol.get(symbol));
	}

}
