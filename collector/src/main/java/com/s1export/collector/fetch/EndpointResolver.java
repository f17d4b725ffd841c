package com.s1export.collector.fetch;

import com.s1export.collector.config.ApiTarget;
import com.s1export.collector.config.DatasetDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Orders the endpoints to try for a dataset. Alternate paths on the primary base come
 * before any fallback base, since a fallback base is a different API version. Fallback
 * bases are only used when the base URL is not pinned; each is tried with the primary
 * path first and then the alternates.
 */
public class EndpointResolver {

    private final ApiTarget target;

    public EndpointResolver(ApiTarget target) {
        this.target = target;
    }

    public List<EndpointCandidate> candidates(DatasetDescriptor descriptor) {
        List<EndpointCandidate> candidates = new ArrayList<>();
        String primaryBase = target.primaryBaseUrl();

        candidates.add(new EndpointCandidate(primaryBase, descriptor.primaryPath(), Provenance.PRIMARY));
        for (String alternate : descriptor.alternatePaths()) {
            candidates.add(new EndpointCandidate(primaryBase, alternate, Provenance.ALTERNATE));
        }

        if (!target.pinned()) {
            for (String fallbackBase : target.fallbackBaseUrls()) {
                candidates.add(new EndpointCandidate(fallbackBase, descriptor.primaryPath(), Provenance.FALLBACK));
                for (String alternate : descriptor.alternatePaths()) {
                    candidates.add(new EndpointCandidate(fallbackBase, alternate, Provenance.FALLBACK));
                }
            }
        }
        return candidates;
    }
}
