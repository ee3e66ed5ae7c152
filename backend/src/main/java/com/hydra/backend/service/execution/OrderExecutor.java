package com.hydra.backend.service.execution;

import com.hydra.backend.model.Position;
import com.hydra.backend.trading.pipeline.RiskDecision;

/**
 * Broker boundary. A rejection and a fill that never completes are reported the same way.
 */
public interface OrderExecutor {

    ExecutionResult submit(RiskDecision approved);

    ExecutionResult closePosition(Position position, double price);
}
