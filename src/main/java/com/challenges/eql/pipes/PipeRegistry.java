package com.challenges.eql.pipes;

import com.challenges.eql.ast.DuplicateDefinitionException;
import com.challenges.eql.ast.PipeCommand;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lookup table from pipe name to pipe kind. Built once, read-only afterwards.
 */
public final class PipeRegistry {

    private final ImmutableMap<String, PipeKind> kinds;

    private PipeRegistry(ImmutableMap<String, PipeKind> kinds) {
        this.kinds = kinds;
    }

    public static PipeRegistry of(PipeKind... kinds) {
        return of(Arrays.asList(kinds));
    }

    public static PipeRegistry of(Iterable<? extends PipeKind> kinds) {
        MutableMap<String, PipeKind> lookup = Maps.mutable.empty();
        for (PipeKind kind : kinds) {
            PipeKind existing = lookup.get(kind.name());
            if (existing != null) {
                throw new DuplicateDefinitionException(kind.name(),
                        "Pipe " + describe(existing) + " already registered as " + kind.name()
                                + ", can't register " + describe(kind));
            }
            lookup.put(kind.name(), kind);
        }
        return new PipeRegistry(lookup.toImmutable());
    }

    public static PipeRegistry builtins() {
        return of(BuiltinPipes.all());
    }

    public Optional<PipeKind> lookup(String name) {
        return Optional.ofNullable(kinds.get(name));
    }

    public PipeKind require(PipeCommand pipe) {
        return lookup(pipe.name())
                .orElseThrow(() -> new IllegalArgumentException("Unknown pipe: " + pipe.name()));
    }

    private static String describe(PipeKind kind) {
        return kind.toString();
    }
}
