package com.stride.backend.controller;

import com.stride.backend.metrics.SecurityMetricsCollector;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Tag(name = "security")
@RestController
@RequestMapping("/api/security/metrics")
@RequiredArgsConstructor
public class SecurityMetricsController {

    private final SecurityMetricsCollector securityMetrics;

    @GetMapping
    public ResponseEntity<Map<String, Long>> metrics() {
        return ResponseEntity.ok(securityMetrics.getMetrics());
    }

    @PostMapping("/reset")
    public ResponseEntity<Void> reset() {
        securityMetrics.reset();
        return ResponseEntity.noContent().build();
    }
}
