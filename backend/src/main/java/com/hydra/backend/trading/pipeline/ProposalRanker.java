package com.hydra.backend.trading.pipeline;

import com.hydra.backend.config.StrategyProperties;
import com.hydra.backend.model.TradeProposal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders proposals by confidence x reward-to-risk x strategy weight, highest first.
 * Equal scores fall back to the configured strategy priority, then to submission order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProposalRanker {

    private final StrategyProperties strategyProperties;
    private final StrategyWeightService weightService;

    public List<RankedProposal> rank(List<TradeProposal> proposals) {
        List<RankedProposal> ranked = new ArrayList<>(proposals.size());
        for (TradeProposal proposal : proposals) {
            double weight = weightService.weightOf(proposal.strategyId());
            double score = proposal.confidence() * proposal.rewardToRisk() * weight;
            ranked.add(new RankedProposal(proposal, weight, score));
        }
        // List.sort is a stable merge sort
        ranked.sort(Comparator.comparingDouble(RankedProposal::score).reversed()
                .thenComparingInt(r -> strategyProperties.priorityOf(r.proposal().strategyId())));
        return ranked;
    }

    /**
     * The ranked list cut to the per-cycle limit.
     */
    public List<RankedProposal> top(List<TradeProposal> proposals) {
        List<RankedProposal> ranked = rank(proposals);
        int limit = Math.min(strategyProperties.getTopK(), ranked.size());
        if (ranked.size() > limit) {
            log.debug("Forwarding {} of {} proposals", limit, ranked.size());
        }
        return List.copyOf(ranked.subList(0, limit));
    }
}
