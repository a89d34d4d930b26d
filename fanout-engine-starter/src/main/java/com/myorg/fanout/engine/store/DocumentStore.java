package com.myorg.fanout.engine.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Minimal document store contract the engine runs on.
 *
 * <p>Single-document create/update/remove are expected to be atomic. Implementations report a
 * unique-key conflict with {@link DuplicateDocumentException}; any other {@link RuntimeException}
 * is treated as an upstream failure.
 */
public interface DocumentStore {

    /**
     * Inserts a copy of {@code doc}, assigning an {@code id} when it has none.
     *
     * @return the stored document
     */
    ObjectNode create(String collection, ObjectNode doc);

    Optional<ObjectNode> read(String collection, DocumentQuery query);

    List<ObjectNode> list(String collection, DocumentQuery query, ListOptions options);

    /**
     * Sets every field of {@code set} (dotted paths allowed) on the matching documents.
     *
     * @return number of documents updated
     */
    int update(String collection, DocumentQuery query, ObjectNode set);

    /**
     * @return number of documents removed
     */
    int remove(String collection, DocumentQuery query);
}
