package com.hydra.backend.trading.pipeline;

import com.hydra.backend.model.TradeProposal;

public record RankedProposal(
        TradeProposal proposal,
        double strategyWeight,
        double score
) {}
