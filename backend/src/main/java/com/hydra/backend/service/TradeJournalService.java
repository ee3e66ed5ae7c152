package com.hydra.backend.service;

import com.hydra.backend.model.TradeJournalEntry;
import com.hydra.backend.model.TradeOutcome;
import com.hydra.backend.repository.TradeJournalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradeJournalService {

    private final TradeJournalRepository tradeJournalRepository;

    public void record(TradeOutcome outcome) {
        TradeJournalEntry entry = TradeJournalEntry.builder()
                .positionId(outcome.positionId())
                .strategyId(outcome.strategyId())
                .asset(outcome.asset())
                .direction(outcome.direction())
                .entryPrice(outcome.entryPrice())
                .exitPrice(outcome.exitPrice())
                .notional(outcome.notional())
                .realizedPnl(outcome.realizedPnl())
                .rMultiple(outcome.rMultiple())
                .exitReason(outcome.exitReason())
                .openedAt(outcome.openedAt())
                .closedAt(outcome.closedAt())
                .build();
        try {
            tradeJournalRepository.save(entry);
        } catch (DataAccessException e) {
            log.error("Failed to journal outcome for position {}", outcome.positionId(), e);
        }
    }

    public List<TradeJournalEntry> recent() {
        return tradeJournalRepository.findTop50ByOrderByClosedAtDesc();
    }
}
