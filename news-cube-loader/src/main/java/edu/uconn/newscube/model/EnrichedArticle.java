package edu.uconn.newscube.model;

import lombok.Value;

import java.util.List;

/**
 * An article after tag matching and entity extraction, retained until the
 * star schema is assembled.
 */
@Value
public class EnrichedArticle {

    ArticleRecord article;
    List<TagMatch> tags;
    List<EntityCandidate> entities;
}
