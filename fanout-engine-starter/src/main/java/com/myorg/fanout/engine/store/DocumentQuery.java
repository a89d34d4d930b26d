package com.myorg.fanout.engine.store;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Equality query over documents: a disjunction of clauses, each clause a conjunction of
 * {@code field == value} terms. Fields may be dotted paths ({@code meta.style}).
 */
public final class DocumentQuery {

    private final List<Map<String, Object>> clauses;

    private DocumentQuery(List<Map<String, Object>> clauses) {
        this.clauses = clauses;
    }

    public static DocumentQuery where(String field, Object value) {
        Map<String, Object> clause = new LinkedHashMap<>();
        clause.put(field, value);
        return new DocumentQuery(List.of(Collections.unmodifiableMap(clause)));
    }

    // a clause without terms matches every document
    public static DocumentQuery all() {
        return new DocumentQuery(List.of(Map.of()));
    }

    public static DocumentQuery byId(String id) {
        return where("id", id);
    }

    public static DocumentQuery anyOf(DocumentQuery... queries) {
        List<Map<String, Object>> all = new ArrayList<>();
        for (DocumentQuery q : queries) {
            all.addAll(q.clauses);
        }
        return new DocumentQuery(List.copyOf(all));
    }

    /**
     * Adds a term to every clause.
     */
    public DocumentQuery and(String field, Object value) {
        List<Map<String, Object>> next = new ArrayList<>(clauses.size());
        for (Map<String, Object> c : clauses) {
            Map<String, Object> copy = new LinkedHashMap<>(c);
            copy.put(field, value);
            next.add(Collections.unmodifiableMap(copy));
        }
        return new DocumentQuery(List.copyOf(next));
    }

    public List<Map<String, Object>> clauses() {
        return clauses;
    }

    public boolean matches(JsonNode doc) {
        if (doc == null) return false;
        for (Map<String, Object> clause : clauses) {
            boolean ok = true;
            for (Map.Entry<String, Object> term : clause.entrySet()) {
                if (!valueMatches(doc.at(pointer(term.getKey())), term.getValue())) {
                    ok = false;
                    break;
                }
            }
            if (ok) return true;
        }
        return false;
    }

    static JsonPointer pointer(String dottedPath) {
        return JsonPointer.compile("/" + dottedPath.replace('.', '/'));
    }

    private static boolean valueMatches(JsonNode actual, Object expected) {
        if (actual == null || actual.isMissingNode() || actual.isNull()) return expected == null;
        if (expected == null) return false;
        if (expected instanceof Boolean b) return actual.isBoolean() && actual.booleanValue() == b;
        if (expected instanceof Number n) {
            return actual.isNumber() && actual.decimalValue().compareTo(new BigDecimal(n.toString())) == 0;
        }
        return actual.isValueNode() && actual.asText().equals(expected.toString());
    }

    @Override
    public String toString() {
        return "DocumentQuery" + clauses;
    }
}
