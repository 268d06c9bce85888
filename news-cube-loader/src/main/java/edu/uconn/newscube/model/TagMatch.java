package edu.uconn.newscube.model;

import lombok.Value;

@Value
public class TagMatch {

    String tagName;

    /**
     * In [0, 1]; the maximum over every matching strategy that fired.
     */
    double confidence;
}
