package knitscript.model;

import java.util.Iterator;

/**
 * The face of the fabric a row is worked on.
 */
public enum Side {
	RIGHT("RS"),
	WRONG("WS");

	private final String symbol;

	Side(String symbol) {
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}

	public Side flip() {
		return this == RIGHT ? WRONG : RIGHT;
	}

	/**
	 * @return an endless iterator over this side, then the opposite side, then this side again
	 */
	public Iterator<Side> alternate() {
		return new Iterator<Side>() {
			private Side next = Side.this;

			@Override
			public boolean hasNext() {
				return true;
			}

			@Override
			public Side next() {
				Side current = next;
				next = next.flip();
				return current;
			}
		};
	}

	public static Side fromSymbol(String symbol) {
		for (Side side : values()) {
			if (side.symbol.equals(symbol)) {
				return side;
			}
		}
		throw new IllegalArgumentException("unknown side " + symbol);
	}

}
