package com.hydra.backend.trading.strategy;

import com.hydra.backend.model.MarketSnapshot;
import com.hydra.backend.model.Regime;
import com.hydra.backend.model.RegimeState;
import com.hydra.backend.model.TradeProposal;

import java.util.List;
import java.util.Set;

/**
 * A proposal generator. Implementations are pure functions of the snapshot and the regime, so the
 * pipeline may run them concurrently. Returning no proposals is a normal outcome.
 */
public interface TradingStrategy {

    String id();

    Set<Regime> eligibleRegimes();

    List<TradeProposal> propose(MarketSnapshot snapshot, RegimeState regime);
}
