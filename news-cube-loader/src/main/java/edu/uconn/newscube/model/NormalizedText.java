package edu.uconn.newscube.model;

import lombok.Value;

/**
 * Matching-ready lowercase views of an article. {@code combined} is the
 * primary search surface for tag and entity matching.
 */
@Value
public class NormalizedText {

    public static final NormalizedText EMPTY = new NormalizedText("", "", "", "");

    String headline;
    String body;
    String consolidated;
    String combined;
}
