package edu.uconn.newscube.output;

import edu.uconn.newscube.model.StarSchema;

/**
 * Persists a finished star schema. Implementations write every table or none.
 */
public interface StarSchemaWriter {

    void write(StarSchema schema);
}
