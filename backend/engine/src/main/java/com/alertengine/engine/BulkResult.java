package com.alertengine.engine;

import java.util.List;
import java.util.Map;

/**
 * {@code unchanged} lists alerts already in the requested or a terminal state; {@code failed}
 * maps alert ids to the reason they could not be processed.
 */
public record BulkResult(int requested, List<String> changed, List<String> unchanged, Map<String, String> failed) {
    public BulkResult {
        changed = List.copyOf(changed);
        unchanged = List.copyOf(unchanged);
        failed = Map.copyOf(failed);
    }
}
