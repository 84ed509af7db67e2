package edu.stanford.futuredata.shardview.utilities;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.*;

/**
 * Options bag passed to the view loader.  Keys listed in {@link #LOADER_KEYS} steer the loader
 * itself; everything else is handed through to the per-shard store query.
 */
public class ViewOptions {

    public static final String ASCENDING = "ascending";
    public static final String DATABASES = "databases";
    public static final String MAPPER = "mapper";
    public static final String MAX_RANGE = "max_range";
    public static final String END_KEYMAP = "end_keymap";
    public static final String KEYMAP = "keymap";
    public static final String START_KEYMAP = "start_keymap";
    public static final String CHUNKED_MAPPER = "chunked_mapper";
    public static final String CHUNK_RESPONSE_TYPE = "chunk_response_type";
    public static final String CHUNK_SIZE = "chunk_size";
    public static final String TRANSPORT = "transport";
    public static final String IS_CHUNKED = "is_chunked";
    public static final String CREATED_FROM = "created_from";
    public static final String CREATED_TO = "created_to";
    public static final String RANGE_END_KEYMAP = "range_end_keymap";
    public static final String RANGE_KEY_NAME = "range_key_name";
    public static final String RANGE_KEYMAP = "range_keymap";
    public static final String RANGE_START_KEYMAP = "range_start_keymap";

    public static final String STARTKEY = "startkey";
    public static final String ENDKEY = "endkey";
    public static final String DESCENDING = "descending";
    public static final String LIMIT = "limit";
    public static final String INCLUDE_DOCS = "include_docs";
    public static final String REDUCE = "reduce";
    public static final String GROUP = "group";
    public static final String GROUP_LEVEL = "group_level";

    public static final Set<String> LOADER_KEYS = Set.of(ASCENDING, DATABASES, MAPPER, MAX_RANGE,
            END_KEYMAP, KEYMAP, START_KEYMAP,
            CHUNKED_MAPPER, CHUNK_RESPONSE_TYPE, CHUNK_SIZE, TRANSPORT, IS_CHUNKED,
            CREATED_FROM, CREATED_TO, RANGE_END_KEYMAP, RANGE_KEY_NAME, RANGE_KEYMAP, RANGE_START_KEYMAP);

    private final Map<String, Object> options;

    public ViewOptions() {
        this.options = new LinkedHashMap<>();
    }

    private ViewOptions(Map<String, Object> options) {
        this.options = options;
    }

    public ViewOptions set(String key, Object value) {
        options.put(key, value);
        return this;
    }

    public boolean isDefined(String key) {
        return options.get(key) != null;
    }

    public Object get(String key) {
        return options.get(key);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = options.get(key);
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }

    // Value of the first key holding a non-null value, or null.
    public Object getFirstDefined(String... keys) {
        for (String key: keys) {
            Object value = options.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public Optional<Long> getLong(String key) {
        Object value = options.get(key);
        if (value instanceof Number) {
            return Optional.of(((Number) value).longValue());
        } else if (value instanceof JsonNode && ((JsonNode) value).canConvertToLong()) {
            return Optional.of(((JsonNode) value).longValue());
        } else if (value instanceof String) {
            try {
                return Optional.of(Long.parseLong((String) value));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    // Empty when missing or outside the int range.
    public Optional<Integer> getInteger(String key) {
        return getLong(key).filter(v -> v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE).map(Long::intValue);
    }

    public Optional<String> getString(String key) {
        Object value = options.get(key);
        if (value instanceof JsonNode) {
            return ((JsonNode) value).isTextual() ? Optional.of(((JsonNode) value).asText()) : Optional.empty();
        }
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    public boolean isTrue(String key) {
        Object value = options.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        } else if (value instanceof JsonNode) {
            return Utilities.isTrue((JsonNode) value);
        }
        return value != null && "true".equalsIgnoreCase(value.toString());
    }

    // False only when the value is present and reads as false.
    public boolean isFalse(String key) {
        Object value = options.get(key);
        if (value instanceof Boolean) {
            return !(Boolean) value;
        } else if (value instanceof JsonNode) {
            return Utilities.isFalse((JsonNode) value);
        }
        return value != null && "false".equalsIgnoreCase(value.toString());
    }

    // A copy with the given keys removed.
    public ViewOptions without(Collection<String> keys) {
        Map<String, Object> copy = new LinkedHashMap<>(options);
        keys.forEach(copy::remove);
        return new ViewOptions(copy);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(options);
    }

    @Override
    public String toString() {
        return options.keySet().toString();
    }
}
