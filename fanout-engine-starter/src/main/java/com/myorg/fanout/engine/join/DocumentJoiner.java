package com.myorg.fanout.engine.join;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.fanout.engine.store.DocumentQuery;
import com.myorg.fanout.engine.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class DocumentJoiner implements Joiner {

    private final DocumentStore store;
    private final ObjectMapper mapper;

    @Override
    public Optional<ObjectNode> lookup(Profile profile, String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        return store.read(profile.collection(), DocumentQuery.byId(id)).map(doc -> project(doc, profile));
    }

    @Override
    public void inflate(ObjectNode doc, Map<String, Profile> references) {
        Map<String, String> ids = new LinkedHashMap<>();
        synchronized (doc) {
            references.keySet().forEach(field -> {
                JsonNode ref = doc.get(field + "Id");
                if (ref != null && ref.isValueNode() && !ref.asText().isBlank()) {
                    ids.put(field, ref.asText());
                }
            });
        }
        Map<String, ObjectNode> loaded = new LinkedHashMap<>();
        ids.forEach((field, id) -> {
            Optional<ObjectNode> found = lookup(references.get(field), id);
            if (found.isPresent()) {
                loaded.put(field, found.get());
            } else {
                log.debug("Dangling reference field={} id={} collection={}", field, id, references.get(field).collection());
            }
        });
        synchronized (doc) {
            loaded.forEach(doc::set);
        }
    }

    @Override
    public void fill(List<ObjectNode> parents, FillSpec spec) {
        for (ObjectNode parent : parents) {
            String parentId;
            synchronized (parent) {
                parentId = parent.path("id").asText(null);
            }
            ArrayNode children = mapper.createArrayNode();
            if (parentId != null) {
                for (ObjectNode child : store.list(spec.collection(),
                        DocumentQuery.where(spec.foreignKey(), parentId), spec.options())) {
                    if (!spec.inflate().isEmpty()) {
                        inflate(child, spec.inflate());
                    }
                    children.add(child);
                }
            }
            synchronized (parent) {
                parent.set(spec.as(), children);
            }
        }
    }

    private ObjectNode project(ObjectNode doc, Profile profile) {
        if (profile.keepsAll()) return doc;
        ObjectNode out = mapper.createObjectNode();
        out.set("id", doc.get("id"));
        for (String field : profile.fields()) {
            JsonNode v = doc.get(field);
            if (v != null) out.set(field, v);
        }
        return out;
    }
}
