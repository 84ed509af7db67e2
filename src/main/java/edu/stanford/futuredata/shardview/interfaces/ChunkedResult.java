package edu.stanford.futuredata.shardview.interfaces;

import com.fasterxml.jackson.databind.JsonNode;
import edu.stanford.futuredata.shardview.utilities.LoadError;

import java.util.List;

/**
 * What a {@link ChunkedMapper} made of a batch.
 */
public final class ChunkedResult {

    public enum Kind {
        // JSON rows for the loader to encode and send.
        ROWS,
        // CSV lines for the loader to send as one chunk.
        LINES,
        // The mapper wrote to the transport itself; only the count is reported.
        SENT,
        // Stop querying.  Whatever was sent stays sent.
        STOP
    }

    public final Kind kind;
    public final List<JsonNode> rows;
    public final List<String> lines;
    public final int sentCount;
    public final LoadError error;

    private ChunkedResult(Kind kind, List<JsonNode> rows, List<String> lines, int sentCount, LoadError error) {
        this.kind = kind;
        this.rows = rows;
        this.lines = lines;
        this.sentCount = sentCount;
        this.error = error;
    }

    public static ChunkedResult rows(List<JsonNode> rows) {
        return new ChunkedResult(Kind.ROWS, rows, List.of(), rows.size(), null);
    }

    public static ChunkedResult lines(List<String> lines) {
        return new ChunkedResult(Kind.LINES, List.of(), lines, lines.size(), null);
    }

    // Lines that carry a header as well as rows: only rowCount counts towards the page.
    public static ChunkedResult lines(List<String> lines, int rowCount) {
        return new ChunkedResult(Kind.LINES, List.of(), lines, rowCount, null);
    }

    // The mapper wrote count rows itself.  The stream only counts as started if it opened the transport.
    public static ChunkedResult sent(int count) {
        return new ChunkedResult(Kind.SENT, List.of(), List.of(), count, null);
    }

    public static ChunkedResult stop() {
        return new ChunkedResult(Kind.STOP, List.of(), List.of(), 0, null);
    }

    // Stop and fail the request with the given error.
    public static ChunkedResult stop(LoadError error) {
        return new ChunkedResult(Kind.STOP, List.of(), List.of(), 0, error);
    }
}
