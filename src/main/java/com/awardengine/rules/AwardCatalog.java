package com.awardengine.rules;

import com.awardengine.contract.MetricKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered list of every award definition for the game.
 *
 * Built once: the first successful {@link #load(List)} fixes the content and
 * any later call is ignored. Until then the catalog is empty. Evaluation order
 * is definition order.
 */
public class AwardCatalog {

    private static final Logger log = LoggerFactory.getLogger(AwardCatalog.class);

    private volatile List<AwardDefinition> definitions = List.of();
    private volatile boolean loaded;

    /**
     * Validates and installs the definitions.
     *
     * @return true if this call loaded the catalog, false if it was already loaded
     * @throws CatalogConfigurationException if any definition is malformed
     */
    public synchronized boolean load(List<AwardDefinition> candidates) {
        if (loaded) {
            log.debug("Award catalog already loaded with {} definitions, ignoring reload",
                definitions.size());
            return false;
        }

        List<AwardDefinition> validated = validate(candidates);
        definitions = validated;
        loaded = true;
        log.info("Award catalog loaded: {} definitions", validated.size());
        return true;
    }

    public boolean isLoaded() {
        return loaded;
    }

    public List<AwardDefinition> definitions() {
        return definitions;
    }

    public Optional<AwardDefinition> find(String achievementKey) {
        return definitions.stream()
            .filter(d -> d.achievementKey().equals(achievementKey))
            .findFirst();
    }

    public int size() {
        return definitions.size();
    }

    private static List<AwardDefinition> validate(List<AwardDefinition> candidates) {
        if (candidates == null) {
            throw new CatalogConfigurationException("award definitions are required");
        }
        Set<String> seenKeys = new HashSet<>();
        for (AwardDefinition definition : candidates) {
            if (definition == null) {
                throw new CatalogConfigurationException("award definition cannot be null");
            }
            String key = definition.achievementKey();
            if (key == null || key.isBlank()) {
                throw new CatalogConfigurationException("achievement key is required");
            }
            if (!seenKeys.add(key)) {
                throw new CatalogConfigurationException("duplicate achievement key: " + key);
            }
            if (definition.condition() == null) {
                throw new CatalogConfigurationException("condition is required for " + key);
            }
            for (AwardCondition.MetricRef ref : definition.condition().references()) {
                MetricKind declared = ref.metric().kind();
                if (declared != ref.expectedKind()) {
                    throw new CatalogConfigurationException(
                        key + " reads " + ref.metric().getValue() + " as " + ref.expectedKind()
                            + " but it is declared " + declared);
                }
            }
        }
        return List.copyOf(candidates);
    }
}
