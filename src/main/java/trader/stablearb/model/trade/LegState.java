package trader.stablearb.model.trade;

public enum LegState {
    PENDING,
    SUBMITTED,
    FILLED,
    FAILED
}
