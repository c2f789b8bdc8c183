package com.challenges.eql.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.tuple.Tuples;

import java.util.Objects;

/**
 * Variables and paths in scope of the event. Path elements are {@code String} keys or {@code Integer} indices.
 */
public record Field(String base, ImmutableList<Object> path) implements Expression {

    /** Root that addresses the array of events matched by a join or sequence. */
    public static final String EVENTS = "events";

    public Field {
        Objects.requireNonNull(base, "base");
        path = path == null ? Lists.immutable.empty() : path;
        for (Object key : path) {
            if (!(key instanceof String) && !(key instanceof Integer)) {
                throw new IllegalArgumentException("Invalid path element for field " + base + ": " + key);
            }
        }
    }

    public Field(String base) {
        this(base, Lists.immutable.empty());
    }

    public static Field of(String base, Object... path) {
        return new Field(base, Lists.immutable.of(path));
    }

    /**
     * Get the index into the event array and the field within that event.
     */
    public Pair<Integer, Field> queryMultipleEvents() {
        if (EVENTS.equals(base) && path.size() >= 2) {
            if (path.get(0) instanceof Integer index && path.get(1) instanceof String key) {
                return Tuples.pair(index, new Field(key, Lists.immutable.ofAll(path.castToList().subList(2, path.size()))));
            }
        }
        return Tuples.pair(0, this);
    }

    public ImmutableList<Object> fullPath() {
        return Lists.immutable.<Object>of(base).newWithAll(path);
    }
}
