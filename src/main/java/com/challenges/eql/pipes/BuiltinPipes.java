package com.challenges.eql.pipes;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Pipes known to every registry created with {@link PipeRegistry#builtins()}. None of them changes the event
 * schemas.
 */
public final class BuiltinPipes {

    public static final PipeKind HEAD = new NamedPipe("head");
    public static final PipeKind TAIL = new NamedPipe("tail");
    public static final PipeKind SORT = new NamedPipe("sort");
    public static final PipeKind UNIQUE = new NamedPipe("unique");
    public static final PipeKind UNIQUE_COUNT = new NamedPipe("unique_count");
    public static final PipeKind COUNT = new NamedPipe("count");
    public static final PipeKind FILTER = new NamedPipe("filter");

    private BuiltinPipes() {
    }

    public static ImmutableList<PipeKind> all() {
        return Lists.immutable.of(HEAD, TAIL, SORT, UNIQUE, UNIQUE_COUNT, COUNT, FILTER);
    }

    record NamedPipe(String name) implements PipeKind {
    }
}
