package com.challenges.eql.walk;

import com.challenges.eql.ast.And;
import com.challenges.eql.ast.Comparison;
import com.challenges.eql.ast.Constant;
import com.challenges.eql.ast.EqlAnalytic;
import com.challenges.eql.ast.EqlNode;
import com.challenges.eql.ast.EventQuery;
import com.challenges.eql.ast.FunctionCall;
import com.challenges.eql.ast.InSet;
import com.challenges.eql.ast.Join;
import com.challenges.eql.ast.Macro;
import com.challenges.eql.ast.MathOperation;
import com.challenges.eql.ast.NamedParams;
import com.challenges.eql.ast.NamedSubquery;
import com.challenges.eql.ast.Not;
import com.challenges.eql.ast.Or;
import com.challenges.eql.ast.PipeCommand;
import com.challenges.eql.ast.PipedQuery;
import com.challenges.eql.ast.Sequence;
import com.challenges.eql.ast.SubqueryBy;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.stream.Stream;

/**
 * Iterates over every node of a tree.
 */
public class Walker {

    /**
     * Lazily flatten a tree in pre-order: the node first, then the nodes of each attribute in declaration order.
     * Every call starts a fresh traversal.
     */
    public Stream<EqlNode> iterate(EqlNode root) {
        return Stream.concat(Stream.of(root), children(root).stream().flatMap(this::iterate));
    }

    /**
     * The immediate child nodes, in attribute order with lists expanded element-wise.
     */
    public MutableList<EqlNode> children(EqlNode node) {
        MutableList<EqlNode> children = Lists.mutable.empty();
        if (node instanceof FunctionCall call) {
            children.addAllIterable(call.arguments());
        } else if (node instanceof NamedSubquery subquery) {
            children.add(subquery.query());
        } else if (node instanceof MathOperation math) {
            children.with(math.left()).with(math.right());
        } else if (node instanceof Comparison comparison) {
            children.with(comparison.left()).with(comparison.right());
        } else if (node instanceof InSet inSet) {
            children.add(inSet.expression());
            children.addAllIterable(inSet.container());
        } else if (node instanceof And and) {
            children.addAllIterable(and.terms());
        } else if (node instanceof Or or) {
            children.addAllIterable(or.terms());
        } else if (node instanceof Not not) {
            children.add(not.term());
        } else if (node instanceof EventQuery query) {
            children.add(query.query());
        } else if (node instanceof NamedParams params) {
            children.addAll(params.kv().values());
        } else if (node instanceof SubqueryBy subquery) {
            children.with(subquery.query()).with(subquery.params());
            children.addAllIterable(subquery.joinValues());
        } else if (node instanceof Join join) {
            children.addAllIterable(join.queries());
            if (join.close() != null) {
                children.add(join.close());
            }
        } else if (node instanceof Sequence sequence) {
            children.addAllIterable(sequence.queries());
            children.add(sequence.params());
            if (sequence.close() != null) {
                children.add(sequence.close());
            }
        } else if (node instanceof PipeCommand pipe) {
            children.addAllIterable(pipe.arguments());
        } else if (node instanceof PipedQuery piped) {
            children.add(piped.first());
            children.addAllIterable(piped.pipes());
        } else if (node instanceof EqlAnalytic analytic) {
            children.add(analytic.query());
        } else if (node instanceof Constant constant) {
            children.add(constant.value());
        } else if (node instanceof Macro macro) {
            children.add(macro.expression());
        }
        // literals, time ranges and fields are leaves
        return children;
    }
}
