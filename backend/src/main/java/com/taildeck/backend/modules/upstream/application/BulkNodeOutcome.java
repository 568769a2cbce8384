package com.taildeck.backend.modules.upstream.application;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

public record BulkNodeOutcome(String action, List<NodeResult> results, Summary summary) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record NodeResult(String nodeId, boolean success, String error) {

        static NodeResult succeeded(String nodeId) {
            return new NodeResult(nodeId, true, null);
        }

        static NodeResult failed(String nodeId, String error) {
            return new NodeResult(nodeId, false, error);
        }
    }

    public record Summary(int total, int succeeded, int failed) {
    }

    public List<String> succeededIds() {
        return results.stream().filter(NodeResult::success).map(NodeResult::nodeId).toList();
    }
}
