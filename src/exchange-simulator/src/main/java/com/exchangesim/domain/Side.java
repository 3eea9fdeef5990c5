package com.exchangesim.domain;

import com.exchangesim.exception.UnknownSideException;

/**
 * Side of an order. Carries the side-specific parts of matching so the
 * matcher runs one code path for both directions.
 */
public enum Side {

    BUY {
        @Override
        public Side opposite() {
            return SELL;
        }

        @Override
        public boolean crosses(Price incoming, Price resting) {
            return incoming.compareTo(resting) >= 0;
        }

        @Override
        public long positionSign() {
            return 1;
        }
    },

    SELL {
        @Override
        public Side opposite() {
            return BUY;
        }

        @Override
        public boolean crosses(Price incoming, Price resting) {
            return incoming.compareTo(resting) <= 0;
        }

        @Override
        public long positionSign() {
            return -1;
        }
    };

    public abstract Side opposite();

    /**
     * True when an incoming order on this side at {@code incoming} may trade
     * against a resting order at {@code resting}.
     */
    public abstract boolean crosses(Price incoming, Price resting);

    /**
     * +1 for BUY, -1 for SELL. Applied to the aggressor's executed quantity.
     */
    public abstract long positionSign();

    /**
     * Resolve an already-normalized side code.
     *
     * @throws UnknownSideException if the code is neither BUY nor SELL
     */
    public static Side fromCode(long orderId, String code) {
        if (BUY.name().equals(code)) {
            return BUY;
        }
        if (SELL.name().equals(code)) {
            return SELL;
        }
        throw new UnknownSideException(orderId, code);
    }
}
