package edu.uconn.newscube.model;

import java.util.Collections;
import java.util.List;

/**
 * Ordered tag taxonomy. Order determines Tag_Key assignment.
 */
public class TagTaxonomy {

    private static final TagTaxonomy EMPTY = new TagTaxonomy(Collections.emptyList());

    private final List<TagDefinition> definitions;

    public TagTaxonomy(List<TagDefinition> definitions) {
        this.definitions = List.copyOf(definitions);
    }

    public static TagTaxonomy empty() {
        return EMPTY;
    }

    public List<TagDefinition> getDefinitions() {
        return definitions;
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    public int size() {
        return definitions.size();
    }
}
