package edu.stanford.futuredata.shardview.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.stanford.futuredata.shardview.interfaces.ConfigSource;
import edu.stanford.futuredata.shardview.utilities.Utilities;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-through configuration cache.  A category document is looked up in the in-process cache,
 * then in the catalog, then in the bundled {@code config/<category>.json} resource.  Inside a
 * document, the section named after this node wins over the "default" section.
 */
public class ConfigCache implements ConfigSource {
    private static final Logger logger = LoggerFactory.getLogger(ConfigCache.class);

    public static final String DEFAULT_SECTION = "default";
    public static final String BUNDLED_PREFIX = "config/";

    private final String nodeName;
    // Null when running without a catalog.
    private final ConfigCatalog catalog;
    private final Map<String, ObjectNode> cache = new ConcurrentHashMap<>();

    public ConfigCache(String nodeName) {
        this(nodeName, null);
    }

    public ConfigCache(String nodeName, ConfigCatalog catalog) {
        this.nodeName = nodeName;
        this.catalog = catalog;
    }

    /*
     * READS
     */

    public Optional<JsonNode> get(String category, String key) {
        ObjectNode document = category(category);
        JsonNode nodeSection = document.get(nodeName);
        if (nodeSection != null && nodeSection.hasNonNull(key)) {
            return Optional.of(nodeSection.get(key));
        }
        JsonNode defaultSection = document.get(DEFAULT_SECTION);
        if (defaultSection != null && defaultSection.hasNonNull(key)) {
            return Optional.of(defaultSection.get(key));
        }
        return Optional.empty();
    }

    @Override
    public int getPositiveInt(String category, String key, int defaultValue) {
        Optional<JsonNode> value = get(category, key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        JsonNode v = value.get();
        if (v.canConvertToInt() && v.isIntegralNumber() && v.intValue() > 0) {
            return v.intValue();
        } else if (v.isTextual()) {
            try {
                int parsed = Integer.parseInt(v.asText());
                return parsed > 0 ? parsed : defaultValue;
            } catch (NumberFormatException e) {
                logger.warn("Config {}/{} is not an integer: {}", category, key, v.asText());
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public String getString(String category, String key, String defaultValue) {
        return get(category, key).map(JsonNode::asText).orElse(defaultValue);
    }

    /*
     * WRITES
     */

    // Set a value in this node's section.
    public boolean set(String category, String key, Object value) {
        return setInSection(category, nodeName, key, value);
    }

    public boolean setDefault(String category, String key, Object value) {
        return setInSection(category, DEFAULT_SECTION, key, value);
    }

    private boolean setInSection(String category, String section, String key, Object value) {
        ObjectNode document = category(category).deepCopy();
        JsonNode existing = document.get(section);
        ObjectNode target = existing != null && existing.isObject() ? (ObjectNode) existing : document.putObject(section);
        target.set(key, Utilities.toJson(value));
        boolean stored = catalog == null || catalog.storeCategory(category, document);
        if (!stored) {
            logger.warn("Could not store config {}/{}/{}", category, section, key);
            flush(category);
            return false;
        }
        cache.put(category, document);
        return true;
    }

    /*
     * INVALIDATION
     */

    public void flush() {
        cache.clear();
    }

    public void flush(String category) {
        cache.remove(category);
    }

    // Replace the cached document with the bundled defaults.  False if there are none.
    public boolean importCategory(String category) {
        Optional<ObjectNode> bundled = loadBundled(category);
        bundled.ifPresent(document -> cache.put(category, document));
        return bundled.isPresent();
    }

    /*
     * LOADING
     */

    private ObjectNode category(String category) {
        return cache.computeIfAbsent(category, this::loadCategory);
    }

    private ObjectNode loadCategory(String category) {
        if (catalog != null) {
            Optional<ObjectNode> stored = catalog.fetchCategory(category);
            if (stored.isPresent()) {
                return stored.get();
            }
        }
        return loadBundled(category).orElseGet(Utilities.objectMapper::createObjectNode);
    }

    private static Optional<ObjectNode> loadBundled(String category) {
        String resource = BUNDLED_PREFIX + category + ".json";
        try (InputStream in = ConfigCache.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                return Optional.empty();
            }
            JsonNode document = Utilities.objectMapper.readTree(IOUtils.toString(in, StandardCharsets.UTF_8));
            if (!document.isObject()) {
                logger.warn("Bundled config {} is not a JSON object", resource);
                return Optional.empty();
            }
            return Optional.of((ObjectNode) document);
        } catch (IOException e) {
            logger.error("Reading bundled config {} failed: {}", resource, e.getMessage());
            return Optional.empty();
        }
    }
}
