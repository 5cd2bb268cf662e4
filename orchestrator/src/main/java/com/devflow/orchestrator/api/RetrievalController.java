package com.devflow.orchestrator.api;

import com.devflow.orchestrator.api.dto.FetchRequest;
import com.devflow.orchestrator.api.dto.FetchResponse;
import com.devflow.orchestrator.api.dto.ProbeResponse;
import com.devflow.orchestrator.retrieval.NoSuitableStrategyException;
import com.devflow.orchestrator.retrieval.QueryOrchestrator;
import com.devflow.orchestrator.retrieval.ResourceType;
import com.devflow.orchestrator.retrieval.RetrievalCancelledException;
import com.devflow.orchestrator.retrieval.RetrievalRequest;
import com.devflow.orchestrator.retrieval.probe.ProbeRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;

/**
 * REST API for retrievals.
 *
 * POST /retrievals             fetch one resource, falling back across strategies
 * GET  /retrievals/strategies  list the registered strategies, cheapest first
 *
 * Every retrieval outcome, failures included, answers 200 with the outcome
 * tag in the body. 400 is reserved for requests that cannot be attempted,
 * 503 for a fetch cancelled because its thread was interrupted (shutdown).
 */
@RestController
@RequestMapping("/retrievals")
public class RetrievalController {

    private final QueryOrchestrator orchestrator;
    private final ProbeRegistry     registry;

    public RetrievalController(QueryOrchestrator orchestrator, ProbeRegistry registry) {
        this.orchestrator = orchestrator;
        this.registry     = registry;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/retrievals \
     *     -H "Content-Type: application/json" \
     *     -d '{"resource":"PR_DIFF","key":"octo/widgets#42"}'
     */
    @PostMapping
    public FetchResponse fetch(@RequestBody FetchRequest req) {
        RetrievalRequest request;
        try {
            request = new RetrievalRequest(parseResource(req.resource()), req.key(), req.sizeHint());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        try {
            return FetchResponse.from(orchestrator.execute(request));
        } catch (NoSuitableStrategyException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (RetrievalCancelledException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e);
        }
    }

    @GetMapping("/strategies")
    public List<ProbeResponse> strategies() {
        return registry.all().stream().map(ProbeResponse::from).toList();
    }

    private static ResourceType parseResource(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("resource is required");
        }
        try {
            return ResourceType.valueOf(raw.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown resource type: '" + raw + "'");
        }
    }
}
