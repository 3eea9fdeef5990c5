package com.exchangesim.exception;

/**
 * Order submitted to a book for a different instrument
 */
public class SymbolMismatchException extends OrderRejectedException {

    private final String orderSymbol;
    private final String bookSymbol;

    public SymbolMismatchException(long orderId, String orderSymbol, String bookSymbol) {
        super(orderId, "Order symbol '" + orderSymbol
                + "' does not match OrderBook symbol '" + bookSymbol + "'");
        this.orderSymbol = orderSymbol;
        this.bookSymbol = bookSymbol;
    }

    public String getOrderSymbol() {
        return orderSymbol;
    }

    public String getBookSymbol() {
        return bookSymbol;
    }

    @Override
    public String getReason() {
        return "SYMBOL_MISMATCH";
    }
}
