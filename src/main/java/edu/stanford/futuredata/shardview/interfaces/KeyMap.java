package edu.stanford.futuredata.shardview.interfaces;

import com.fasterxml.jackson.databind.JsonNode;
import edu.stanford.futuredata.shardview.utilities.Utilities;
import edu.stanford.futuredata.shardview.utilities.ViewOptions;
import edu.stanford.futuredata.shardview.utilities.ViewRequest;

import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Computes a start or end key for a plain (non-ranged) load: a constant, a function of the
 * request, or a function of the options and the request.
 */
public final class KeyMap {

    private final BiFunction<ViewOptions, ViewRequest, JsonNode> fn;

    private KeyMap(BiFunction<ViewOptions, ViewRequest, JsonNode> fn) {
        this.fn = fn;
    }

    public static KeyMap constant(Object key) {
        JsonNode k = Utilities.toJson(key);
        return new KeyMap((options, request) -> k);
    }

    public static KeyMap fromRequest(Function<ViewRequest, JsonNode> fn) {
        return new KeyMap((options, request) -> fn.apply(request));
    }

    public static KeyMap fromOptions(BiFunction<ViewOptions, ViewRequest, JsonNode> fn) {
        return new KeyMap(fn);
    }

    // A KeyMap stays as it is, null (Java or JSON) means no bound, anything else becomes a constant key.
    public static KeyMap of(Object spec) {
        if (spec == null || (spec instanceof JsonNode && ((JsonNode) spec).isNull())) {
            return null;
        } else if (spec instanceof KeyMap) {
            return (KeyMap) spec;
        }
        return constant(spec);
    }

    public JsonNode resolve(ViewRequest request, ViewOptions options) {
        return fn.apply(options, request);
    }
}
