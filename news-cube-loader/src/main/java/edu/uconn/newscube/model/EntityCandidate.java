package edu.uconn.newscube.model;

import lombok.Value;
import lombok.With;

/**
 * Organisation found in an article, before dimension-key resolution.
 */
@Value
@With
public class EntityCandidate {

    String displayName;
    String entityType;
    double confidence;
    int mentionCount;
}
