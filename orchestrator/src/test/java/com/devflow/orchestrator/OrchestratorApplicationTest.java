package com.devflow.orchestrator;

import com.devflow.orchestrator.retrieval.ResourceType;
import com.devflow.orchestrator.retrieval.RetrievalRequest;
import com.devflow.orchestrator.retrieval.probe.CapabilityProbe;
import com.devflow.orchestrator.retrieval.probe.ProbeRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static com.devflow.orchestrator.retrieval.RetrievalStrategy.DELEGATED_ANALYSIS;
import static com.devflow.orchestrator.retrieval.RetrievalStrategy.LIGHTWEIGHT_QUERY;
import static com.devflow.orchestrator.retrieval.RetrievalStrategy.STRUCTURED_API;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wiring check: the full context starts and every probe is registered with
 * its configured ceiling. No collaborator is called.
 */
@SpringBootTest(properties = {
        "devflow.tracker.base-url=",
        "devflow.retrieval.structured-api.capacity-ceiling=25000"
})
class OrchestratorApplicationTest {

    @Autowired ProbeRegistry registry;

    @Test
    void contextLoads_withAllProbesRegistered() {
        assertThat(registry.all()).extracting(CapabilityProbe::strategy)
                .containsExactly(STRUCTURED_API, LIGHTWEIGHT_QUERY, DELEGATED_ANALYSIS);
        assertThat(registry.get(STRUCTURED_API).policy().capacityCeiling()).isEqualTo(25_000);
        assertThat(registry.get(LIGHTWEIGHT_QUERY).policy().capacityCeiling()).isEqualTo(200_000);
        assertThat(registry.get(DELEGATED_ANALYSIS).policy().isUnbounded()).isTrue();
    }

    @Test
    void tickets_notOfferedWithoutTracker() {
        assertThat(registry.rank(RetrievalRequest.of(ResourceType.TICKET, "OPS-7"))).isEmpty();
    }
}
