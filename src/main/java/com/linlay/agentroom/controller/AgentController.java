package com.linlay.agentroom.controller;

import com.linlay.agentroom.agent.AgentProfile;
import com.linlay.agentroom.agent.AgentRegistry;
import com.linlay.agentroom.model.api.AgentSummaryResponse;
import com.linlay.agentroom.model.api.ApiResponse;
import com.linlay.agentroom.model.api.TrustGrantRequest;
import com.linlay.agentroom.model.api.TrustStatusResponse;
import com.linlay.agentroom.ratelimit.RateLimitStats;
import com.linlay.agentroom.ratelimit.RateLimiter;
import com.linlay.agentroom.trust.TrustLedger;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final AgentRegistry agentRegistry;
    private final TrustLedger trustLedger;
    private final RateLimiter rateLimiter;

    public AgentController(AgentRegistry agentRegistry, TrustLedger trustLedger, RateLimiter rateLimiter) {
        this.agentRegistry = agentRegistry;
        this.trustLedger = trustLedger;
        this.rateLimiter = rateLimiter;
    }

    @GetMapping("/agents")
    public ApiResponse<List<AgentSummaryResponse>> agents() {
        List<AgentSummaryResponse> items = agentRegistry.list().stream()
                .map(this::toSummary)
                .toList();
        return ApiResponse.success(items);
    }

    @PostMapping("/trust/{agent}")
    public ApiResponse<TrustStatusResponse> grantTrust(
            @PathVariable String agent,
            @Valid @RequestBody TrustGrantRequest request
    ) {
        String name = agentRegistry.get(agent).name();
        trustLedger.grant(name, request.durationSeconds());
        log.info("Trust granted to '{}' for {}s via api", name, request.durationSeconds());
        return ApiResponse.success(status(name));
    }

    @GetMapping("/trust/{agent}")
    public ApiResponse<TrustStatusResponse> trust(@PathVariable String agent) {
        return ApiResponse.success(status(agentRegistry.get(agent).name()));
    }

    @DeleteMapping("/trust/{agent}")
    public ApiResponse<TrustStatusResponse> revokeTrust(@PathVariable String agent) {
        String name = agentRegistry.get(agent).name();
        trustLedger.revoke(name);
        return ApiResponse.success(status(name));
    }

    @GetMapping("/rate-limits/{provider}")
    public ApiResponse<RateLimitStats> rateLimit(@PathVariable String provider) {
        return ApiResponse.success(rateLimiter.getStats(provider));
    }

    private TrustStatusResponse status(String name) {
        return new TrustStatusResponse(name, trustLedger.isTrusted(name), trustLedger.remainingSeconds(name));
    }

    private AgentSummaryResponse toSummary(AgentProfile profile) {
        return new AgentSummaryResponse(
                profile.name(),
                profile.providerId(),
                profile.modelId(),
                profile.name().equals(agentRegistry.defaultAgentName()),
                trustLedger.isTrusted(profile.name()),
                trustLedger.remainingSeconds(profile.name())
        );
    }
}
