package edu.stanford.futuredata.shardview.interfaces;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.LongNode;
import edu.stanford.futuredata.shardview.utilities.Utilities;

import java.util.function.LongFunction;

/**
 * Turns a resolved timestamp into a view key for ranged loads.
 * <ul>
 *     <li>nil: no bound at all.</li>
 *     <li>absent: the timestamp itself.</li>
 *     <li>scalar K: {@code [timestamp, K]}.</li>
 *     <li>array: the array with the timestamp appended.</li>
 *     <li>function: called with the timestamp.</li>
 * </ul>
 */
public final class RangeKeyMap {

    private final LongFunction<JsonNode> fn;

    private RangeKeyMap(LongFunction<JsonNode> fn) {
        this.fn = fn;
    }

    public static RangeKeyMap nil() {
        return new RangeKeyMap(ts -> null);
    }

    public static RangeKeyMap identity() {
        return new RangeKeyMap(LongNode::valueOf);
    }

    public static RangeKeyMap of(LongFunction<JsonNode> fn) {
        return new RangeKeyMap(fn);
    }

    public static RangeKeyMap suffix(JsonNode k) {
        if (k == null || k.isMissingNode()) {
            return identity();
        } else if (k.isArray()) {
            return new RangeKeyMap(ts -> {
                ArrayNode key = ((ArrayNode) k).deepCopy();
                key.add(ts);
                return key;
            });
        }
        return new RangeKeyMap(ts -> {
            ArrayNode key = Utilities.objectMapper.createArrayNode();
            key.add(ts);
            key.add(k);
            return key;
        });
    }

    // Leading-constant keys: scalar K becomes [K, timestamp], arrays get the timestamp appended.
    public static RangeKeyMap prefix(JsonNode k) {
        if (k == null || k.isMissingNode()) {
            return identity();
        } else if (k.isArray()) {
            return suffix(k);
        }
        return new RangeKeyMap(ts -> {
            ArrayNode key = Utilities.objectMapper.createArrayNode();
            key.add(k);
            key.add(ts);
            return key;
        });
    }

    /**
     * Build a map from an option value: null (absent) is identity, a JSON null is nil, a
     * RangeKeyMap is used as is, anything else goes through {@link #suffix}.
     */
    public static RangeKeyMap fromSpec(Object spec) {
        if (spec == null) {
            return identity();
        } else if (spec instanceof RangeKeyMap) {
            return (RangeKeyMap) spec;
        }
        JsonNode k = Utilities.toJson(spec);
        if (k.isNull()) {
            return nil();
        }
        return suffix(k);
    }

    public JsonNode apply(long timestamp) {
        return fn.apply(timestamp);
    }
}
