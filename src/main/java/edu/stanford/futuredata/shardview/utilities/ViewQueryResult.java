package edu.stanford.futuredata.shardview.utilities;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * What a store hands back for one shard query: an ordered batch, "not found", or an error.
 */
public class ViewQueryResult {

    public enum Status {
        OK, NOT_FOUND, ERROR
    }

    public final Status status;
    public final List<JsonNode> rows;
    public final String reason;

    private ViewQueryResult(Status status, List<JsonNode> rows, String reason) {
        this.status = status;
        this.rows = rows;
        this.reason = reason;
    }

    public static ViewQueryResult ok(List<JsonNode> rows) {
        return new ViewQueryResult(Status.OK, List.copyOf(rows), null);
    }

    public static ViewQueryResult notFound() {
        return new ViewQueryResult(Status.NOT_FOUND, List.of(), "not_found");
    }

    public static ViewQueryResult error(String reason) {
        return new ViewQueryResult(Status.ERROR, List.of(), reason);
    }
}
