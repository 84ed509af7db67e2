package edu.stanford.futuredata.shardview.utilities;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Why a view load failed.  Errors are plain values: the parameter builder raises them inside a
 * {@link LoadException}, the fold records them on the query descriptor.
 */
public class LoadError {

    public enum Kind {
        // Invalid time range.  Never retried.
        VALIDATION(400),
        // Missing shard or view on the last shard of the request.
        NOT_FOUND(404),
        // Any other store failure.
        DATA_STORE(500),
        // The caller asked for something the loader cannot do (e.g. chunked without a transport).
        CONFIGURATION(500),
        // A caller-supplied callback blew up.
        SYSTEM_FAULT(500);

        public final int httpCode;

        Kind(int httpCode) {
            this.httpCode = httpCode;
        }
    }

    public final Kind kind;
    public final String code;
    public final String field;
    public final String message;
    public final JsonNode cause;

    public LoadError(Kind kind, String code, String field, String message, JsonNode cause) {
        this.kind = kind;
        this.code = code;
        this.field = field;
        this.message = message;
        this.cause = cause;
    }

    public static LoadError validation(String field, String code, String message, JsonNode cause) {
        return new LoadError(Kind.VALIDATION, code, field, message, cause);
    }

    public static LoadError missingResource(String view, String shard) {
        return new LoadError(Kind.NOT_FOUND, "bad_identifier", null,
                String.format("missing resource: view %s on %s", view, shard), null);
    }

    public static LoadError dataStore(String reason, String view, String shard) {
        return new LoadError(Kind.DATA_STORE, "datastore_fault", null,
                String.format("querying view %s on %s failed: %s", view, shard, reason), null);
    }

    public static LoadError configuration(String code, String message) {
        return new LoadError(Kind.CONFIGURATION, code, null, message, null);
    }

    public static LoadError systemFault(String code, String message) {
        return new LoadError(Kind.SYSTEM_FAULT, code, null, message, null);
    }

    public ObjectNode toJson() {
        ObjectNode o = Utilities.objectMapper.createObjectNode();
        o.put("error", code);
        o.put("error_code", kind.httpCode);
        o.put("message", message);
        if (field != null) {
            o.put("field", field);
        }
        if (cause != null) {
            o.set("cause", cause);
        }
        return o;
    }

    @Override
    public String toString() {
        return String.format("%s/%s: %s", kind, code, message);
    }
}
