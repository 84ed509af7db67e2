package edu.stanford.futuredata.shardview.interfaces;

import com.google.protobuf.ByteString;

import java.io.IOException;
import java.util.Map;

public interface ChunkTransport {
    /*
     The streaming side of a response.  Once started, the response can only be appended to.
     */

    // Headers the caller staged for the response.
    Map<String, String> responseHeaders();
    // Start the chunked response.  Called at most once.
    void openChunked(Map<String, String> headers) throws IOException;
    // Append a chunk to a started response.
    void writeChunk(ByteString chunk) throws IOException;
    // Has openChunked been called?
    boolean isChunkStarted();
}
