package org.energycal.catalog;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named calibration sources and their reference energies, read from a document shaped like
 *
 * <pre>
 * {"sources": {"Co-60": {"energies": [{"value": 1173.2, "description": "gamma"}, ...]}}}
 * </pre>
 *
 * Single-quoted strings are accepted as well.
 */
public final class SourceCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceCatalog.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(JsonParser.Feature.ALLOW_SINGLE_QUOTES, true)
            .configure(JsonParser.Feature.ALLOW_TRAILING_COMMA, true);

    private final List<CatalogSource> sources;

    private SourceCatalog(List<CatalogSource> sources) {
        this.sources = Collections.unmodifiableList(sources);
    }

    public static SourceCatalog empty() {
        return new SourceCatalog(new ArrayList<>());
    }

    public static SourceCatalog load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            SourceCatalog catalog = load(in);
            LOGGER.info("Loaded {} calibration sources from {}", catalog.sources.size(), file);
            return catalog;
        }
    }

    public static SourceCatalog load(InputStream in) throws IOException {
        JsonNode root = MAPPER.readTree(in);
        if (root == null || !root.path("sources").isObject()) {
            throw new IOException("Catalog has no 'sources' object.");
        }

        List<CatalogSource> sources = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.get("sources").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<ReferenceEnergy> energies = new ArrayList<>();
            for (JsonNode energy : field.getValue().path("energies")) {
                JsonNode value = energy.get("value");
                if (value == null || !value.isNumber()) {
                    throw new IOException("Source '" + field.getKey() + "' has an energy without a numeric value.");
                }
                energies.add(new ReferenceEnergy(value.asDouble(), energy.path("description").asText("")));
            }
            sources.add(new CatalogSource(field.getKey(), energies));
        }
        return new SourceCatalog(sources);
    }

    public List<CatalogSource> getSources() { return sources; }

    public Optional<CatalogSource> find(String name) {
        return sources.stream().filter(s -> s.getName().equals(name)).findFirst();
    }
}
