package com.hydra.backend.repository;

import com.hydra.backend.model.RiskEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RiskEventRepository extends JpaRepository<RiskEvent, Long> {
    List<RiskEvent> findTop50ByOrderByCreatedAtDesc();
}
