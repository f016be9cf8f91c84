package com.simtrader.engine;

import com.simtrader.core.model.TradeRetcode;

/**
 * Internal signal that a request failed a check. Converted to a rejection
 * result before leaving the matching engine.
 */
class TradeRejectedException extends Exception {

    private final TradeRetcode retcode;

    TradeRejectedException(TradeRetcode retcode, String message) {
        super(message);
        this.retcode = retcode;
    }

    TradeRejectedException(TradeRetcode retcode) {
        this(retcode, retcode.getDescription());
    }

    TradeRetcode getRetcode() {
        return retcode;
    }
}
