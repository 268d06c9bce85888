package edu.uconn.newscube.transform;

import edu.uconn.newscube.entity.DimEntity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Maps an extracted entity name to its Dim_Entity key. Tiers are tried in
 * order and the first hit wins:
 * <ol>
 *   <li>exact display name</li>
 *   <li>normalized name</li>
 *   <li>core word, so "Reata" finds "Reata Pharmaceuticals"</li>
 * </ol>
 */
public class EntityKeyResolver {

    private static final Comparator<DimEntity> SHORTEST_NAME = Comparator
        .comparingInt((DimEntity entity) -> entity.getEntityName().length())
        .thenComparing(DimEntity::getEntityName);

    private final Map<String, Integer> keysByName = new HashMap<>();
    private final Map<String, Integer> keysByNormalized = new HashMap<>();
    private final Map<String, List<DimEntity>> entitiesByCoreWord = new HashMap<>();

    private final List<Function<String, Optional<Integer>>> tiers = List.of(
        this::byExactName,
        this::byNormalizedName,
        this::byCoreWord
    );

    public EntityKeyResolver(List<DimEntity> dimEntity) {
        for (DimEntity entity : dimEntity) {
            String name = entity.getEntityName().strip();
            keysByName.putIfAbsent(name, entity.getEntityKey());

            String normalized = EntityNames.normalize(name);
            if (!normalized.isEmpty()) {
                keysByNormalized.putIfAbsent(normalized, entity.getEntityKey());
            }

            String core = EntityNames.coreWord(name);
            if (!core.isEmpty()) {
                entitiesByCoreWord.computeIfAbsent(core, c -> new ArrayList<>()).add(entity);
            }
        }
    }

    public Optional<Integer> resolve(String entityName) {
        if (entityName == null || entityName.isBlank()) {
            return Optional.empty();
        }
        String name = entityName.strip();
        for (Function<String, Optional<Integer>> tier : tiers) {
            Optional<Integer> key = tier.apply(name);
            if (key.isPresent()) {
                return key;
            }
        }
        return Optional.empty();
    }

    private Optional<Integer> byExactName(String name) {
        return Optional.ofNullable(keysByName.get(name));
    }

    private Optional<Integer> byNormalizedName(String name) {
        return Optional.ofNullable(keysByNormalized.get(EntityNames.normalize(name)));
    }

    /**
     * A lone candidate always wins. A single-word query picks the shortest
     * name, then the lexically first. A multi-word query first prefers the
     * candidate sharing the most leading words with it.
     */
    private Optional<Integer> byCoreWord(String name) {
        List<DimEntity> candidates = entitiesByCoreWord.get(EntityNames.coreWord(name));
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0).getEntityKey());
        }
        if (EntityNames.isSingleWord(name)) {
            return candidates.stream().min(SHORTEST_NAME).map(DimEntity::getEntityKey);
        }

        List<String> queryWords = EntityNames.words(name);
        Comparator<DimEntity> mostSharedWords = Comparator.comparingInt(
            (DimEntity entity) -> sharedLeadingWords(queryWords, EntityNames.words(entity.getEntityName())));
        return candidates.stream()
            .min(mostSharedWords.reversed().thenComparing(SHORTEST_NAME))
            .map(DimEntity::getEntityKey);
    }

    private static int sharedLeadingWords(List<String> left, List<String> right) {
        int shared = 0;
        while (shared < left.size() && shared < right.size() && left.get(shared).equals(right.get(shared))) {
            shared++;
        }
        return shared;
    }
}
