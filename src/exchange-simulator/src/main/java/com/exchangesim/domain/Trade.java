package com.exchangesim.domain;

/**
 * One execution between an aggressing (incoming) order and a resting order.
 * Always priced at the resting order's price.
 */
public class Trade {

    private final String tradeId;
    private final String symbol;
    private final long buyOrderId;
    private final long sellOrderId;
    private final Price price;
    private final long quantity;
    private final Side aggressorSide;

    public Trade(String tradeId, String symbol, long buyOrderId, long sellOrderId,
                 Price price, long quantity, Side aggressorSide) {
        this.tradeId = tradeId;
        this.symbol = symbol;
        this.buyOrderId = buyOrderId;
        this.sellOrderId = sellOrderId;
        this.price = price;
        this.quantity = quantity;
        this.aggressorSide = aggressorSide;
    }

    public String getTradeId() {
        return tradeId;
    }

    public String getSymbol() {
        return symbol;
    }

    public long getBuyOrderId() {
        return buyOrderId;
    }

    public long getSellOrderId() {
        return sellOrderId;
    }

    public Price getPrice() {
        return price;
    }

    public long getQuantity() {
        return quantity;
    }

    public Side getAggressorSide() {
        return aggressorSide;
    }

    /**
     * Signed contribution of this trade to the aggressor's position.
     */
    public long getSignedQuantity() {
        return aggressorSide.positionSign() * quantity;
    }

    @Override
    public String toString() {
        return "Trade{" +
                "tradeId='" + tradeId + '\'' +
                ", symbol='" + symbol + '\'' +
                ", buyOrderId=" + buyOrderId +
                ", sellOrderId=" + sellOrderId +
                ", price=" + price +
                ", quantity=" + quantity +
                ", aggressorSide=" + aggressorSide +
                '}';
    }
}
