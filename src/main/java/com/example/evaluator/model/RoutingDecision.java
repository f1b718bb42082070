package com.example.evaluator.model;

import java.util.Set;

/**
 * Which tasks an upload triggers.
 *
 * @param categories what the upload was recognised as
 * @param scheduled  routed tasks that run for this upload
 * @param excluded   routed tasks left out; they keep their persisted result, if any
 */
public record RoutingDecision(
        Set<DocumentCategory> categories,
        Set<String> scheduled,
        Set<String> excluded
) {
    public RoutingDecision {
        categories = Set.copyOf(categories);
        scheduled = Set.copyOf(scheduled);
        excluded = Set.copyOf(excluded);
    }
}
