package com.myorg.fanout.engine.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

//Lưu document trong RAM, dùng cho môi trường dev/test hoặc app chỉ có 1 instance.
// Mỗi collection giữ thứ tự chèn; mọi thao tác trên 1 collection được khóa theo collection đó.
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private static final class Collection {
        final Map<String, ObjectNode> docs = new LinkedHashMap<>();
        final List<List<String>> uniqueKeys = new ArrayList<>();
    }

    private final ConcurrentHashMap<String, Collection> collections = new ConcurrentHashMap<>();

    /**
     * Declares a unique index over {@code fields} (dotted paths allowed).
     */
    public InMemoryDocumentStore uniqueIndex(String collection, String... fields) {
        Collection c = collection(collection);
        synchronized (c) {
            c.uniqueKeys.add(List.of(fields));
        }
        return this;
    }

    @Override
    public ObjectNode create(String collection, ObjectNode doc) {
        ObjectNode copy = doc.deepCopy();
        if (!copy.hasNonNull("id") || copy.get("id").asText().isBlank()) {
            copy.put("id", UUID.randomUUID().toString());
        }
        String id = copy.get("id").asText();
        Collection c = collection(collection);
        synchronized (c) {
            if (c.docs.containsKey(id)) {
                throw new DuplicateDocumentException(collection, "id=" + id);
            }
            for (List<String> key : c.uniqueKeys) {
                DocumentQuery same = sameKey(key, copy);
                if (same == null) continue;
                for (ObjectNode existing : c.docs.values()) {
                    if (same.matches(existing)) {
                        throw new DuplicateDocumentException(collection, same.clauses().get(0).toString());
                    }
                }
            }
            c.docs.put(id, copy);
        }
        log.debug("Created document collection={} id={}", collection, id);
        return copy.deepCopy();
    }

    @Override
    public Optional<ObjectNode> read(String collection, DocumentQuery query) {
        Collection c = collection(collection);
        synchronized (c) {
            for (ObjectNode doc : c.docs.values()) {
                if (query.matches(doc)) return Optional.of(doc.deepCopy());
            }
        }
        return Optional.empty();
    }

    @Override
    public List<ObjectNode> list(String collection, DocumentQuery query, ListOptions options) {
        List<ObjectNode> out = new ArrayList<>();
        Collection c = collection(collection);
        synchronized (c) {
            for (ObjectNode doc : c.docs.values()) {
                if (query.matches(doc)) out.add(doc.deepCopy());
            }
        }
        ListOptions opts = options == null ? ListOptions.none() : options;
        if (opts.sortField() != null) {
            Comparator<ObjectNode> cmp = Comparator.comparing(
                    d -> d.at(DocumentQuery.pointer(opts.sortField())), InMemoryDocumentStore::compareValues);
            out.sort(opts.direction() < 0 ? cmp.reversed() : cmp);
        }
        if (opts.limit() != null && out.size() > opts.limit()) {
            out = new ArrayList<>(out.subList(0, Math.max(0, opts.limit())));
        }
        if (opts.reverse()) {
            Collections.reverse(out);
        }
        return out;
    }

    @Override
    public int update(String collection, DocumentQuery query, ObjectNode set) {
        int n = 0;
        Collection c = collection(collection);
        synchronized (c) {
            for (ObjectNode doc : c.docs.values()) {
                if (!query.matches(doc)) continue;
                Iterator<Map.Entry<String, JsonNode>> fields = set.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> f = fields.next();
                    setPath(doc, f.getKey(), f.getValue().deepCopy());
                }
                n++;
            }
        }
        return n;
    }

    @Override
    public int remove(String collection, DocumentQuery query) {
        int n = 0;
        Collection c = collection(collection);
        synchronized (c) {
            Iterator<ObjectNode> it = c.docs.values().iterator();
            while (it.hasNext()) {
                if (query.matches(it.next())) {
                    it.remove();
                    n++;
                }
            }
        }
        return n;
    }

    private Collection collection(String name) {
        return collections.computeIfAbsent(name, k -> new Collection());
    }

    private static DocumentQuery sameKey(List<String> key, ObjectNode doc) {
        DocumentQuery q = null;
        for (String field : key) {
            JsonNode v = doc.at(DocumentQuery.pointer(field));
            if (v.isMissingNode() || v.isNull()) return null;
            Object value = v.isNumber() ? v.numberValue() : v.isBoolean() ? (Object) v.booleanValue() : v.asText();
            q = q == null ? DocumentQuery.where(field, value) : q.and(field, value);
        }
        return q;
    }

    private static void setPath(ObjectNode doc, String dottedPath, JsonNode value) {
        String[] parts = dottedPath.split("\\.");
        ObjectNode cur = doc;
        for (int i = 0; i < parts.length - 1; i++) {
            JsonNode next = cur.get(parts[i]);
            if (next == null || !next.isObject()) {
                next = cur.putObject(parts[i]);
            }
            cur = (ObjectNode) next;
        }
        cur.set(parts[parts.length - 1], value);
    }

    // missing values sort first
    private static int compareValues(JsonNode a, JsonNode b) {
        boolean aMissing = a.isMissingNode() || a.isNull();
        boolean bMissing = b.isMissingNode() || b.isNull();
        if (aMissing || bMissing) return Boolean.compare(!aMissing, !bMissing);
        if (a.isNumber() && b.isNumber()) {
            return new BigDecimal(a.asText()).compareTo(new BigDecimal(b.asText()));
        }
        return a.asText().compareTo(b.asText());
    }
}
