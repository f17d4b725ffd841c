package com.s1export.collector.fetch;

import com.s1export.collector.config.ApiTarget;
import com.s1export.collector.config.DatasetDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EndpointResolverTest {

    private static final String V21 = "https://console.test/web/api/v2.1";
    private static final String V20 = "https://console.test/web/api/v2.0";
    private static final String V2 = "https://console.test/web/api/v2";

    private final DatasetDescriptor rules = new DatasetDescriptor("rules", "/rules",
            List.of("/cloud-detection/rules", "/firewall-control"), Map.of(), true, null);

    @Test
    @DisplayName("Alternate paths on the primary base come before any fallback base")
    void ordering_alternatesBeforeFallbackBases() {
        EndpointResolver resolver = new EndpointResolver(new ApiTarget(V21, List.of(V20, V2), false));

        List<String> urls = resolver.candidates(rules).stream().map(EndpointCandidate::url).toList();

        assertEquals(List.of(
                V21 + "/rules",
                V21 + "/cloud-detection/rules",
                V21 + "/firewall-control",
                V20 + "/rules",
                V20 + "/cloud-detection/rules",
                V20 + "/firewall-control",
                V2 + "/rules",
                V2 + "/cloud-detection/rules",
                V2 + "/firewall-control"), urls);
    }

    @Test
    @DisplayName("Candidates are tagged with their provenance")
    void candidates_taggedWithProvenance() {
        EndpointResolver resolver = new EndpointResolver(new ApiTarget(V21, List.of(V20), false));

        List<Provenance> sources = resolver.candidates(rules).stream().map(EndpointCandidate::source).toList();

        assertEquals(List.of(Provenance.PRIMARY, Provenance.ALTERNATE, Provenance.ALTERNATE,
                Provenance.FALLBACK, Provenance.FALLBACK, Provenance.FALLBACK), sources);
    }

    @Test
    @DisplayName("A pinned base URL yields only primary and alternate paths")
    void pinnedTarget_noFallbackCandidates() {
        EndpointResolver resolver = new EndpointResolver(ApiTarget.pinned(V21));

        List<EndpointCandidate> candidates = resolver.candidates(rules);

        assertEquals(3, candidates.size());
        assertTrue(candidates.stream().allMatch(c -> c.baseUrl().equals(V21)));
    }

    @Test
    @DisplayName("A dataset without alternates and without fallbacks has a single candidate")
    void singleCandidate() {
        EndpointResolver resolver = new EndpointResolver(new ApiTarget(V21, List.of(), false));

        List<EndpointCandidate> candidates = resolver.candidates(DatasetDescriptor.of("sites", "/sites"));

        assertEquals(List.of(new EndpointCandidate(V21, "/sites", Provenance.PRIMARY)), candidates);
    }
}
