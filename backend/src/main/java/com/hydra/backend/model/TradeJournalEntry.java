package com.hydra.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "trade_journal")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeJournalEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String positionId;

    @Column(nullable = false)
    private String strategyId;

    @Column(nullable = false)
    private String asset;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TradeDirection direction;

    private double entryPrice;
    private double exitPrice;
    private double notional;
    private double realizedPnl;
    private double rMultiple;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TradeOutcome.ExitReason exitReason;

    @Column(nullable = false)
    private Instant openedAt;

    @Column(nullable = false)
    private Instant closedAt;
}
