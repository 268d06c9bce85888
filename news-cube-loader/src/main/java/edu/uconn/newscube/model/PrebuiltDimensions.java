package edu.uconn.newscube.model;

import edu.uconn.newscube.entity.DimEntity;
import edu.uconn.newscube.entity.DimSource;
import edu.uconn.newscube.entity.DimTime;
import lombok.Value;

import java.util.List;

/**
 * Dimension tables built from the scan-phase accumulators and handed to the
 * star schema builder so that fact and bridge construction use exactly the
 * same membership.
 */
@Value
public class PrebuiltDimensions {

    List<DimTime> dimTime;
    List<DimSource> dimSource;
    List<DimEntity> dimEntity;
}
