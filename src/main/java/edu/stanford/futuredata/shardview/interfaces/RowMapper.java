package edu.stanford.futuredata.shardview.interfaces;

import com.fasterxml.jackson.databind.JsonNode;
import edu.stanford.futuredata.shardview.utilities.Utilities;
import edu.stanford.futuredata.shardview.utilities.ViewRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Filter/transform applied to every batch a shard returns.  Comes in three shapes, picked when the
 * mapper is created and dispatched on in {@link #apply}:
 * <ul>
 *     <li>{@link Shape#BATCH}: the whole batch at once, in key order.  Must return rows in order.</li>
 *     <li>{@link Shape#FOLD}: a left fold over the rows in key order, starting from an empty list.
 *     Empty results are dropped.</li>
 *     <li>{@link Shape#REQUEST_FOLD}: like FOLD, but also sees the request.</li>
 * </ul>
 */
public final class RowMapper {

    public enum Shape {
        BATCH, FOLD, REQUEST_FOLD
    }

    public interface RequestFold {
        List<JsonNode> apply(ViewRequest request, JsonNode row, List<JsonNode> acc);
    }

    private final Shape shape;
    private final BiFunction<ViewRequest, List<JsonNode>, List<JsonNode>> batchFn;
    private final BiFunction<JsonNode, List<JsonNode>, List<JsonNode>> foldFn;
    private final RequestFold requestFoldFn;

    private RowMapper(Shape shape, BiFunction<ViewRequest, List<JsonNode>, List<JsonNode>> batchFn,
                      BiFunction<JsonNode, List<JsonNode>, List<JsonNode>> foldFn, RequestFold requestFoldFn) {
        this.shape = shape;
        this.batchFn = batchFn;
        this.foldFn = foldFn;
        this.requestFoldFn = requestFoldFn;
    }

    public static RowMapper batch(Function<List<JsonNode>, List<JsonNode>> fn) {
        return new RowMapper(Shape.BATCH, (request, rows) -> fn.apply(rows), null, null);
    }

    public static RowMapper fold(BiFunction<JsonNode, List<JsonNode>, List<JsonNode>> fn) {
        return new RowMapper(Shape.FOLD, null, fn, null);
    }

    public static RowMapper foldWithRequest(RequestFold fn) {
        return new RowMapper(Shape.REQUEST_FOLD, null, null, fn);
    }

    // Emit each row's "doc".
    public static RowMapper docs() {
        return fold((row, acc) -> {
            acc.add(row.get("doc"));
            return acc;
        });
    }

    // Emit each row's "value".
    public static RowMapper values() {
        return fold((row, acc) -> {
            acc.add(row.get("value"));
            return acc;
        });
    }

    // Drop rows whose document fails the filter, then hand the rest to inner (which may be null).
    public static RowMapper withDocFilter(Predicate<JsonNode> docFilter, RowMapper inner) {
        return new RowMapper(Shape.BATCH, (request, rows) -> {
            List<JsonNode> kept = rows.stream()
                    .filter(row -> row.hasNonNull("doc") && docFilter.test(row.get("doc")))
                    .collect(Collectors.toList());
            return applyOrIdentity(inner, request, kept);
        }, null, null);
    }

    public Shape getShape() {
        return shape;
    }

    public List<JsonNode> apply(ViewRequest request, List<JsonNode> rows) {
        switch (shape) {
            case BATCH:
                return batchFn.apply(request, rows);
            case FOLD: {
                List<JsonNode> acc = new ArrayList<>();
                for (JsonNode row: rows) {
                    acc = foldFn.apply(row, acc);
                }
                return dropEmpty(acc);
            }
            case REQUEST_FOLD: {
                List<JsonNode> acc = new ArrayList<>();
                for (JsonNode row: rows) {
                    acc = requestFoldFn.apply(request, row, acc);
                }
                return dropEmpty(acc);
            }
            default:
                throw new IllegalStateException("unknown mapper shape " + shape);
        }
    }

    // No mapper at all: rows go through as they came.
    public static List<JsonNode> applyOrIdentity(RowMapper mapper, ViewRequest request, List<JsonNode> rows) {
        return mapper == null ? new ArrayList<>(rows) : mapper.apply(request, rows);
    }

    private static List<JsonNode> dropEmpty(List<JsonNode> rows) {
        return rows.stream().filter(r -> !Utilities.isEmpty(r)).collect(Collectors.toList());
    }
}
