package com.challenges.eql.functions;

import com.challenges.eql.ast.DuplicateDefinitionException;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lookup table from function name to signature. Built once, read-only afterwards.
 */
public final class FunctionRegistry {

    private static final FunctionRegistry EMPTY = new FunctionRegistry(Maps.immutable.empty());

    private final ImmutableMap<String, FunctionSignature> signatures;

    private FunctionRegistry(ImmutableMap<String, FunctionSignature> signatures) {
        this.signatures = signatures;
    }

    public static FunctionRegistry empty() {
        return EMPTY;
    }

    public static FunctionRegistry of(FunctionSignature... signatures) {
        return of(Arrays.asList(signatures));
    }

    public static FunctionRegistry of(Iterable<? extends FunctionSignature> signatures) {
        MutableMap<String, FunctionSignature> lookup = Maps.mutable.empty();
        for (FunctionSignature signature : signatures) {
            FunctionSignature existing = lookup.get(signature.name());
            if (existing != null) {
                throw new DuplicateDefinitionException(signature.name(), "Function " + signature.name()
                        + " already registered by " + existing.getClass().getSimpleName());
            }
            lookup.put(signature.name(), signature);
        }
        return new FunctionRegistry(lookup.toImmutable());
    }

    /**
     * The built-in functions.
     */
    public static FunctionRegistry builtins() {
        return of(BuiltinFunctions.all());
    }

    /**
     * A registry with the signatures of this one followed by {@code extra}.
     */
    public FunctionRegistry with(FunctionSignature... extra) {
        return of(signatures.valuesView().toList().withAll(Arrays.asList(extra)));
    }

    public Optional<FunctionSignature> lookup(String name) {
        return Optional.ofNullable(signatures.get(name));
    }

    public boolean contains(String name) {
        return signatures.containsKey(name);
    }
}
