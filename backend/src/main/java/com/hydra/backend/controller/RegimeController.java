package com.hydra.backend.controller;

import com.hydra.backend.model.RegimeState;
import com.hydra.backend.trading.pipeline.RegimeDetector;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/regime")
@RequiredArgsConstructor
public class RegimeController {

    private final RegimeDetector regimeDetector;

    @GetMapping("/current")
    public RegimeState current() {
        return regimeDetector.current();
    }
}
