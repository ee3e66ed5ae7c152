package com.hydra.backend.service;

import com.hydra.backend.model.RiskEvent;
import com.hydra.backend.repository.RiskEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
public class RiskEventService {

    private final RiskEventRepository riskEventRepository;

    public RiskEvent record(String type, String description, String metadata) {
        RiskEvent event = RiskEvent.builder()
                .type(type)
                .description(description)
                .metadata(metadata)
                .createdAt(Instant.now())
                .build();
        return riskEventRepository.save(event);
    }

    public List<RiskEvent> recent() {
        return riskEventRepository.findTop50ByOrderByCreatedAtDesc();
    }
}
