package com.alertengine.engine.api;

import com.alertengine.core.model.AlertCategory;
import com.alertengine.engine.scoring.ScoreVector;

import java.util.List;
import java.util.Map;

/**
 * Optional source of extra, context-specific recommended actions (typically a language model).
 */
public interface ActionAugmenter {
    List<String> suggestActions(AlertCategory category, Map<String, Object> sourceData, ScoreVector scores);
}
