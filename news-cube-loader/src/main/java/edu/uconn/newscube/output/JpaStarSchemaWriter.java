package edu.uconn.newscube.output;

import edu.uconn.newscube.model.StarSchema;
import edu.uconn.newscube.repository.BridgeFactEntityRepository;
import edu.uconn.newscube.repository.BridgeFactTagRepository;
import edu.uconn.newscube.repository.DimEntityRepository;
import edu.uconn.newscube.repository.DimSourceRepository;
import edu.uconn.newscube.repository.DimTagRepository;
import edu.uconn.newscube.repository.DimTimeRepository;
import edu.uconn.newscube.repository.FactDocumentRepository;
import edu.uconn.newscube.repository.RejectedEntityRepository;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Replaces the warehouse tables with the new star schema in a single
 * transaction.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "newscube.output", name = "database-enabled", havingValue = "true",
    matchIfMissing = true)
public class JpaStarSchemaWriter implements StarSchemaWriter {

    private final FactDocumentRepository factDocumentRepository;
    private final DimTimeRepository dimTimeRepository;
    private final DimSourceRepository dimSourceRepository;
    private final DimTagRepository dimTagRepository;
    private final DimEntityRepository dimEntityRepository;
    private final BridgeFactTagRepository bridgeFactTagRepository;
    private final BridgeFactEntityRepository bridgeFactEntityRepository;
    private final RejectedEntityRepository rejectedEntityRepository;
    private final EntityManager entityManager;

    @Override
    @Transactional
    public void write(StarSchema schema) {
        bridgeFactEntityRepository.deleteAllInBatch();
        bridgeFactTagRepository.deleteAllInBatch();
        factDocumentRepository.deleteAllInBatch();
        dimEntityRepository.deleteAllInBatch();
        dimTagRepository.deleteAllInBatch();
        dimSourceRepository.deleteAllInBatch();
        dimTimeRepository.deleteAllInBatch();
        rejectedEntityRepository.deleteAllInBatch();
        // bulk deletes bypass the persistence context
        entityManager.clear();
        log.debug("Cleared previous star schema tables");

        dimTimeRepository.saveAll(schema.getDimTime());
        dimSourceRepository.saveAll(schema.getDimSource());
        dimTagRepository.saveAll(schema.getDimTag());
        dimEntityRepository.saveAll(schema.getDimEntity());
        factDocumentRepository.saveAll(schema.getFactDocuments());
        bridgeFactTagRepository.saveAll(schema.getBridgeFactTag());
        bridgeFactEntityRepository.saveAll(schema.getBridgeFactEntity());
        rejectedEntityRepository.saveAll(schema.getRejectedEntities());

        log.info("Loaded star schema into the warehouse: {} facts, {} tag links, {} entity links",
            schema.getFactDocuments().size(), schema.getBridgeFactTag().size(),
            schema.getBridgeFactEntity().size());
    }
}
