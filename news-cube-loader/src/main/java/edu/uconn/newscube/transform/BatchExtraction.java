package edu.uconn.newscube.transform;

import edu.uconn.newscube.model.EntityCandidate;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Entities extracted from one batch of articles.
 */
@Value
public class BatchExtraction {

    /**
     * Candidates per article, in batch order.
     */
    List<List<EntityCandidate>> perArticle;

    /**
     * Best representation per normalized name, for Dim_Entity.
     */
    Map<String, EntityCandidate> dimensionCandidates;

    RejectionLog rejections;
}
