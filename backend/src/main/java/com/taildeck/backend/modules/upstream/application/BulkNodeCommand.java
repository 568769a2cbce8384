package com.taildeck.backend.modules.upstream.application;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record BulkNodeCommand(BulkNodeAction action, List<String> nodeIds, String newUser, List<String> tags) {

    public static final int MAX_NODES = 100;

    public BulkNodeCommand {
        nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
        // null 원소는 validateTags 에서 400 으로 거절한다
        tags = tags == null ? null : Collections.unmodifiableList(new ArrayList<>(tags));
    }
}
