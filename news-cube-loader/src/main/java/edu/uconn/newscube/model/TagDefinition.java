package edu.uconn.newscube.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A resolved taxonomy entry: tag name, its category and domain, and the
 * keywords that signal it.
 */
@Value
@Builder(toBuilder = true)
public class TagDefinition {

    String name;
    String category;
    String domain;
    @Singular
    List<String> keywords;
}
