package edu.uconn.newscube.model;

import edu.uconn.newscube.entity.BridgeFactEntity;
import edu.uconn.newscube.entity.BridgeFactTag;
import edu.uconn.newscube.entity.DimEntity;
import edu.uconn.newscube.entity.DimSource;
import edu.uconn.newscube.entity.DimTag;
import edu.uconn.newscube.entity.DimTime;
import edu.uconn.newscube.entity.FactDocument;
import edu.uconn.newscube.entity.RejectedEntity;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * The finished star schema plus the audit data gathered while building it.
 */
@Value
@Builder(toBuilder = true)
public class StarSchema {

    List<FactDocument> factDocuments;
    List<DimTime> dimTime;
    List<DimSource> dimSource;
    List<DimTag> dimTag;
    List<DimEntity> dimEntity;
    List<BridgeFactTag> bridgeFactTag;
    List<BridgeFactEntity> bridgeFactEntity;

    @Builder.Default
    List<RejectedEntity> rejectedEntities = List.of();

    /**
     * Entity names that no resolution tier could map to Dim_Entity.
     */
    @Builder.Default
    Set<String> unresolvedEntities = Set.of();

    int unresolvedTagCount;
}
