package com.challenges.eql.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key-value parameters such as the timing of a sequence, kept in insertion order.
 */
public record NamedParams(Map<String, Expression> kv) implements EqlNode {

    public NamedParams {
        kv = kv == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(kv));
    }

    public NamedParams() {
        this(null);
    }

    public boolean isEmpty() {
        return kv.isEmpty();
    }
}
