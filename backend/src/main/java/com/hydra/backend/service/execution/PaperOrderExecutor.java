package com.hydra.backend.service.execution;

import com.hydra.backend.model.Position;
import com.hydra.backend.model.TradeProposal;
import com.hydra.backend.trading.pipeline.RiskDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Fills every approved order at its proposed entry and every close at the requested price.
 */
@Slf4j
@Service
public class PaperOrderExecutor implements OrderExecutor {

    @Override
    public ExecutionResult submit(RiskDecision approved) {
        if (!approved.approved()) {
            return ExecutionResult.rejected("decision was not approved");
        }
        TradeProposal proposal = approved.proposal();
        String orderId = "PAPER-" + UUID.randomUUID();
        log.info("Paper fill {} {} {} notional {} @ {}", orderId, proposal.direction(), proposal.asset(),
                String.format("%.2f", approved.sizedNotional()), proposal.entry());
        return ExecutionResult.filled(orderId, proposal.entry());
    }

    @Override
    public ExecutionResult closePosition(Position position, double price) {
        if (price <= 0) {
            return ExecutionResult.rejected("no price to close at");
        }
        String orderId = "PAPER-" + UUID.randomUUID();
        log.info("Paper close {} {} {} @ {}", orderId, position.getId(), position.getAsset(), price);
        return ExecutionResult.filled(orderId, price);
    }
}
