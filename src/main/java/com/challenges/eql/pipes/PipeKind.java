package com.challenges.eql.pipes;

import com.challenges.eql.ast.Expression;
import com.challenges.eql.ast.TypeHint;

import java.util.List;

/**
 * A kind of post-processing stage that {@link com.challenges.eql.ast.PipeCommand} nodes refer to by name.
 */
public interface PipeKind {

    String name();

    /**
     * Schemas of the events that leave the pipe. Schemas are owned by the schema validation layer, so they are
     * opaque here, and most pipes pass them through unchanged.
     */
    default <S> List<S> outputSchemas(List<Expression> arguments, List<TypeHint> typeHints, List<S> eventSchemas) {
        return eventSchemas;
    }
}
