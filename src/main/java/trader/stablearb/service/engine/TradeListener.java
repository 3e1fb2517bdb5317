package trader.stablearb.service.engine;

import trader.stablearb.model.trade.TradeRecord;

/**
 * Notified on the engine thread after a terminal record has been stored. Implementations must not block.
 */
public interface TradeListener {

    void onTradeClosed(TradeRecord record);
}
