package edu.uconn.newscube.model;

import lombok.Value;

/**
 * One row of the company registry.
 */
@Value
public class RegistryEntry {

    String name;
    String entityType;
}
