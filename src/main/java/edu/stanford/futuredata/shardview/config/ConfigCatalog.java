package edu.stanford.futuredata.shardview.config;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

public interface ConfigCatalog {
    /*
     Persistent home of configuration documents, one JSON document per category.
     */

    // The stored document for a category, if any.
    Optional<ObjectNode> fetchCategory(String category);
    // Replace the stored document for a category.  Returns false if the write failed.
    boolean storeCategory(String category, ObjectNode document);
}
