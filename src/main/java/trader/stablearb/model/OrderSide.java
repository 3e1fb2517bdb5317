package trader.stablearb.model;

public enum OrderSide {
    SELL,
    BUY
}
