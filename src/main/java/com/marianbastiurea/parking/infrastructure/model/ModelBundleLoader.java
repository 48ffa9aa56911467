package com.marianbastiurea.parking.infrastructure.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marianbastiurea.parking.domain.model.FeatureVector.Feature;
import com.marianbastiurea.parking.domain.scoring.LinearModel;
import com.marianbastiurea.parking.domain.scoring.ModelBundle;
import com.marianbastiurea.parking.domain.scoring.ValueTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the trained parameters from JSON:
 * <pre>
 * { "suitability":    {"intercept": 0.8, "coefficients": {"priorityLevel": 0.05}},
 *   "bayPreference":  {...},
 *   "slotPreference": {...},
 *   "valueTable": {"states": 120, "actions": 40, "defaultValue": 0.0,
 *                  "entries": [{"state": 0, "action": 3, "value": 0.4}]} }
 * </pre>
 */
public class ModelBundleLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelBundleLoader.class);

    private final ObjectMapper mapper;

    public ModelBundleLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ModelBundle load(Resource resource) {
        Objects.requireNonNull(resource, "resource");
        if (!resource.exists()) {
            throw new IllegalStateException("Model bundle not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            ModelBundle bundle = read(in);
            log.info("Model bundle loaded from {} (states={}, actions={})",
                    resource.getDescription(), bundle.valueTable().states(), bundle.valueTable().actions());
            return bundle;
        } catch (IOException e) {
            log.error("Failed to read model bundle {}", resource.getDescription(), e);
            throw new UncheckedIOException("Cannot read model bundle " + resource.getDescription(), e);
        }
    }

    public ModelBundle read(InputStream in) throws IOException {
        BundleDocument doc = mapper.readValue(in, BundleDocument.class);
        if (doc.suitability() == null || doc.bayPreference() == null
                || doc.slotPreference() == null || doc.valueTable() == null) {
            throw new IllegalStateException(
                    "Model bundle must define suitability, bayPreference, slotPreference and valueTable");
        }
        return new ModelBundle(
                doc.suitability().toModel(),
                doc.bayPreference().toModel(),
                doc.slotPreference().toModel(),
                doc.valueTable().toTable());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BundleDocument(LinearDocument suitability,
                          LinearDocument bayPreference,
                          LinearDocument slotPreference,
                          ValueTableDocument valueTable) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LinearDocument(double intercept, Map<String, Double> coefficients) {

        LinearModel toModel() {
            Map<Feature, Double> weights = new EnumMap<>(Feature.class);
            if (coefficients != null) {
                coefficients.forEach((k, w) -> weights.put(Feature.fromKey(k), w));
            }
            return new LinearModel(intercept, weights);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ValueTableDocument(int states, int actions, double defaultValue, List<EntryDocument> entries) {

        ValueTable toTable() {
            ValueTable.Builder table = ValueTable.builder(states, actions, defaultValue);
            if (entries != null) {
                for (EntryDocument e : entries) {
                    table.set(e.state(), e.action(), e.value());
                }
            }
            return table.build();
        }
    }

    record EntryDocument(int state, int action, double value) {}
}
