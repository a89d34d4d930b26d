package com.myorg.fanout.engine.join;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relational-style joins over the document store.
 *
 * <p>Joins mutate documents in place. The engine issues several joins against the same document
 * concurrently, so implementations must guard their reads and writes of a document.
 */
public interface Joiner {

    Optional<ObjectNode> lookup(Profile profile, String id);

    /**
     * For each {@code field -> profile}, reads {@code <field>Id} from {@code doc} and stores the
     * projected referenced document under {@code field}. Dangling references are left unset.
     */
    void inflate(ObjectNode doc, Map<String, Profile> references);

    void fill(List<ObjectNode> parents, FillSpec spec);
}
