package com.hydra.backend.repository;

import com.hydra.backend.model.TradeJournalEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TradeJournalRepository extends JpaRepository<TradeJournalEntry, Long> {
    List<TradeJournalEntry> findTop50ByOrderByClosedAtDesc();
}
