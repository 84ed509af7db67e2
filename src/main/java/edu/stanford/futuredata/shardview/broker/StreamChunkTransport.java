package edu.stanford.futuredata.shardview.broker;

import com.google.protobuf.ByteString;
import edu.stanford.futuredata.shardview.interfaces.ChunkTransport;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chunk transport over a plain output stream.  Headers are recorded rather than written, the body
 * is the concatenation of all chunks.
 */
public class StreamChunkTransport implements ChunkTransport {

    private final OutputStream out;
    private final Map<String, String> responseHeaders;
    private Map<String, String> sentHeaders = null;
    private int chunksWritten = 0;

    public StreamChunkTransport(OutputStream out) {
        this(out, Map.of());
    }

    public StreamChunkTransport(OutputStream out, Map<String, String> responseHeaders) {
        this.out = out;
        this.responseHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(responseHeaders));
    }

    @Override
    public Map<String, String> responseHeaders() {
        return responseHeaders;
    }

    @Override
    public synchronized void openChunked(Map<String, String> headers) throws IOException {
        if (sentHeaders != null) {
            throw new IllegalStateException("chunked response already started");
        }
        sentHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    @Override
    public synchronized void writeChunk(ByteString chunk) throws IOException {
        if (sentHeaders == null) {
            throw new IllegalStateException("chunk written before the response was started");
        }
        chunk.writeTo(out);
        out.flush();
        chunksWritten++;
    }

    @Override
    public synchronized boolean isChunkStarted() {
        return sentHeaders != null;
    }

    // Headers passed to openChunked, empty until then.
    public synchronized Map<String, String> getSentHeaders() {
        return sentHeaders == null ? Map.of() : sentHeaders;
    }

    public synchronized int getChunksWritten() {
        return chunksWritten;
    }
}
