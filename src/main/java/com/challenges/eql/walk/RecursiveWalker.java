package com.challenges.eql.walk;

import com.challenges.eql.ast.And;
import com.challenges.eql.ast.Comparison;
import com.challenges.eql.ast.Constant;
import com.challenges.eql.ast.EqlAnalytic;
import com.challenges.eql.ast.EqlNode;
import com.challenges.eql.ast.EventQuery;
import com.challenges.eql.ast.Expression;
import com.challenges.eql.ast.Field;
import com.challenges.eql.ast.FunctionCall;
import com.challenges.eql.ast.InSet;
import com.challenges.eql.ast.Join;
import com.challenges.eql.ast.Literal;
import com.challenges.eql.ast.Macro;
import com.challenges.eql.ast.MathOperation;
import com.challenges.eql.ast.NamedParams;
import com.challenges.eql.ast.NamedSubquery;
import com.challenges.eql.ast.Not;
import com.challenges.eql.ast.Or;
import com.challenges.eql.ast.PipeCommand;
import com.challenges.eql.ast.PipedQuery;
import com.challenges.eql.ast.Query;
import com.challenges.eql.ast.Sequence;
import com.challenges.eql.ast.SubqueryBy;
import com.challenges.eql.ast.TimeRange;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Rebuilds a tree bottom-up. Children are rewritten first, then the callback registered for the concrete type of
 * the rebuilt node, if any, replaces it. Nodes without a callback are returned as rebuilt. Input trees are never
 * modified.
 */
public class RecursiveWalker extends Walker {

    private final MutableMap<Class<?>, Function<EqlNode, EqlNode>> callbacks = Maps.mutable.empty();

    /**
     * Register a callback for one concrete node type on this walker.
     */
    public <T extends EqlNode> RecursiveWalker register(Class<T> type, Function<? super T, ? extends EqlNode> callback) {
        callbacks.put(type, node -> callback.apply(type.cast(node)));
        return this;
    }

    public EqlNode walk(EqlNode node) {
        EqlNode rebuilt = rebuild(node);
        Function<EqlNode, EqlNode> callback = callbacks.get(rebuilt.getClass());
        return callback == null ? rebuilt : callback.apply(rebuilt);
    }

    public Expression walkExpression(Expression expression) {
        return walkAs(Expression.class, expression, "expression");
    }

    private <T extends EqlNode> T walkAs(Class<T> type, EqlNode node, String slot) {
        EqlNode result = walk(node);
        if (!type.isInstance(result)) {
            throw new IllegalStateException("Rewriting " + slot + " produced " + result.getClass().getSimpleName()
                    + " where " + type.getSimpleName() + " is required");
        }
        return type.cast(result);
    }

    private EqlNode rebuild(EqlNode node) {
        if (node instanceof Literal || node instanceof TimeRange || node instanceof Field) {
            return node;
        } else if (node instanceof FunctionCall call) {
            return new FunctionCall(call.name(), call.arguments().collect(this::walkExpression), call.asMethod());
        } else if (node instanceof NamedSubquery subquery) {
            return new NamedSubquery(subquery.queryType(), walkAs(EventQuery.class, subquery.query(), "subquery"));
        } else if (node instanceof MathOperation math) {
            return new MathOperation(walkExpression(math.left()), math.operator(), walkExpression(math.right()));
        } else if (node instanceof Comparison comparison) {
            return new Comparison(walkExpression(comparison.left()), comparison.comparator(),
                    walkExpression(comparison.right()));
        } else if (node instanceof InSet inSet) {
            return new InSet(walkExpression(inSet.expression()), inSet.container().collect(this::walkExpression));
        } else if (node instanceof And and) {
            return new And(and.terms().collect(this::walkExpression));
        } else if (node instanceof Or or) {
            return new Or(or.terms().collect(this::walkExpression));
        } else if (node instanceof Not not) {
            return new Not(walkExpression(not.term()));
        } else if (node instanceof EventQuery query) {
            return new EventQuery(query.eventType(), walkExpression(query.query()));
        } else if (node instanceof NamedParams params) {
            Map<String, Expression> kv = new LinkedHashMap<>();
            params.kv().forEach((key, value) -> kv.put(key, walkExpression(value)));
            return new NamedParams(kv);
        } else if (node instanceof SubqueryBy subquery) {
            return new SubqueryBy(
                    walkAs(EventQuery.class, subquery.query(), "query"),
                    walkAs(NamedParams.class, subquery.params(), "params"),
                    subquery.joinValues().collect(this::walkExpression));
        } else if (node instanceof Join join) {
            return new Join(
                    join.queries().collect(query -> walkAs(SubqueryBy.class, query, "queries")),
                    join.close() == null ? null : walkAs(SubqueryBy.class, join.close(), "close"));
        } else if (node instanceof Sequence sequence) {
            return new Sequence(
                    sequence.queries().collect(query -> walkAs(SubqueryBy.class, query, "queries")),
                    walkAs(NamedParams.class, sequence.params(), "params"),
                    sequence.close() == null ? null : walkAs(SubqueryBy.class, sequence.close(), "close"));
        } else if (node instanceof PipeCommand pipe) {
            return new PipeCommand(pipe.name(), pipe.arguments().collect(this::walkExpression));
        } else if (node instanceof PipedQuery piped) {
            return new PipedQuery(
                    walkAs(Query.class, piped.first(), "first"),
                    piped.pipes().collect(pipe -> walkAs(PipeCommand.class, pipe, "pipes")));
        } else if (node instanceof EqlAnalytic analytic) {
            return new EqlAnalytic(walkAs(PipedQuery.class, analytic.query(), "query"), analytic.metadata());
        } else if (node instanceof Constant constant) {
            return new Constant(constant.name(), walkAs(Literal.class, constant.value(), "value"));
        } else if (node instanceof Macro macro) {
            return new Macro(macro.name(), macro.parameters(), walkExpression(macro.expression()));
        }
        throw new IllegalStateException("Unhandled node type: " + node.getClass().getSimpleName());
    }
}
