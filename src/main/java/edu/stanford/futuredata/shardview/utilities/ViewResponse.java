package edu.stanford.futuredata.shardview.utilities;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.stanford.futuredata.shardview.interfaces.ChunkTransport;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Result of a view load.  Either a buffered payload (rows plus envelope) or, once a chunked
 * response has been started, a marker that everything already went out over the transport.
 */
public class ViewResponse {

    public enum Status {
        SUCCESS, ERROR
    }

    private final Status status;
    private final List<JsonNode> data;
    private final ObjectNode envelope;
    private final LoadError error;
    private final boolean chunked;
    private final ChunkTransport transport;

    public ViewResponse(Status status, List<JsonNode> data, ObjectNode envelope, LoadError error,
                        boolean chunked, ChunkTransport transport) {
        this.status = status;
        this.data = Collections.unmodifiableList(data);
        this.envelope = envelope;
        this.error = error;
        this.chunked = chunked;
        this.transport = transport;
    }

    public static ViewResponse failed(LoadError error, ObjectNode envelope, ChunkTransport transport) {
        envelope.put("status", "error");
        envelope.setAll(error.toJson());
        return new ViewResponse(Status.ERROR, List.of(), envelope, error, false, transport);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public List<JsonNode> getData() {
        return data;
    }

    public ObjectNode getEnvelope() {
        return envelope;
    }

    public Optional<LoadError> getError() {
        return Optional.ofNullable(error);
    }

    // True if the response has already been written as chunks.
    public boolean isChunked() {
        return chunked;
    }

    public Optional<ChunkTransport> getTransport() {
        return Optional.ofNullable(transport);
    }

    // Envelope with the rows under "data", as a buffered response body.
    public ObjectNode toJson() {
        ObjectNode body = envelope.deepCopy();
        ArrayNode array = body.putArray("data");
        array.addAll(data);
        return body;
    }
}
