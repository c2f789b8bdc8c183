package com.challenges.eql.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level unit for matching and returning events: a query plus free-form metadata.
 */
public record EqlAnalytic(PipedQuery query, Map<String, Object> metadata) implements EqlNode {

    public EqlAnalytic {
        Objects.requireNonNull(query, "query");
        metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public EqlAnalytic(PipedQuery query) {
        this(query, null);
    }

    public Object id() {
        return metadata.get("id");
    }

    public Object name() {
        return metadata.get("name");
    }
}
