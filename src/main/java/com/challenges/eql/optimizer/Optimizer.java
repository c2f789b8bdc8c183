package com.challenges.eql.optimizer;

import com.challenges.eql.ast.And;
import com.challenges.eql.ast.Comparison;
import com.challenges.eql.ast.EqlNode;
import com.challenges.eql.ast.EventQuery;
import com.challenges.eql.ast.Expression;
import com.challenges.eql.ast.FunctionCall;
import com.challenges.eql.ast.InSet;
import com.challenges.eql.ast.Literal;
import com.challenges.eql.ast.Literal.BooleanLiteral;
import com.challenges.eql.ast.Literal.NumberLiteral;
import com.challenges.eql.ast.Literal.StringLiteral;
import com.challenges.eql.ast.Macro;
import com.challenges.eql.ast.MathOperation;
import com.challenges.eql.ast.NamedParams;
import com.challenges.eql.ast.Not;
import com.challenges.eql.ast.Or;
import com.challenges.eql.ast.PipeCommand;
import com.challenges.eql.ast.SubqueryBy;
import com.challenges.eql.functions.FunctionRegistry;
import com.challenges.eql.functions.FunctionSignature;
import com.challenges.eql.functions.UnsupportedConstantEvaluationException;
import com.challenges.eql.walk.RecursiveWalker;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rewrites expressions into semantically equivalent, more canonical forms: constant folding, set algebra,
 * De Morgan's law and flattening of boolean compounds. Optimization is pure, input trees are never modified.
 */
public class Optimizer {

    private static final Logger log = LoggerFactory.getLogger(Optimizer.class);

    private final FunctionRegistry functions;

    public Optimizer(FunctionRegistry functions) {
        this.functions = Objects.requireNonNull(functions, "functions");
    }

    public FunctionRegistry functions() {
        return functions;
    }

    public Expression optimize(Expression expression) {
        if (expression instanceof FunctionCall call) {
            return optimizeFunctionCall(call);
        } else if (expression instanceof MathOperation math) {
            return optimizeMath(math);
        } else if (expression instanceof Comparison comparison) {
            return optimizeComparison(comparison);
        } else if (expression instanceof InSet inSet) {
            return optimizeInSet(inSet);
        } else if (expression instanceof Not not) {
            return negate(optimize(not.term()));
        } else if (expression instanceof And and) {
            return optimizeAnd(and);
        } else if (expression instanceof Or or) {
            return optimizeOr(or);
        }
        return expression;
    }

    /**
     * Optimize every expression within a query, pipe, analytic or definition.
     */
    public EqlNode optimizeNode(EqlNode node) {
        if (node instanceof Expression expression) {
            return optimize(expression);
        }

        RecursiveWalker walker = new RecursiveWalker()
                .register(EventQuery.class, query -> new EventQuery(query.eventType(), optimize(query.query())))
                .register(NamedParams.class, params -> {
                    Map<String, Expression> kv = new LinkedHashMap<>();
                    params.kv().forEach((key, value) -> kv.put(key, optimize(value)));
                    return new NamedParams(kv);
                })
                .register(SubqueryBy.class, subquery -> new SubqueryBy(subquery.query(), subquery.params(),
                        subquery.joinValues().collect(this::optimize)))
                .register(PipeCommand.class, pipe -> new PipeCommand(pipe.name(), pipe.arguments().collect(this::optimize)))
                .register(Macro.class, macro -> new Macro(macro.name(), macro.parameters(), optimize(macro.expression())));
        return walker.walk(node);
    }

    // ============================================================
    // Function calls and math
    // ============================================================

    private Expression optimizeFunctionCall(FunctionCall call) {
        ImmutableList<Expression> arguments = call.arguments().collect(this::optimize);
        Optional<FunctionSignature> signature = functions.lookup(call.name());

        if (signature.isPresent() && signature.get().isConstantFoldable()
                && arguments.allSatisfy(Literal.class::isInstance)) {
            List<Object> values = new ArrayList<>(arguments.size());
            for (Expression argument : arguments) {
                values.add(((Literal) argument).value());
            }
            try {
                return Literal.fromJava(signature.get().evaluate(values));
            } catch (UnsupportedConstantEvaluationException e) {
                log.debug("Leaving call to {} unevaluated: {}", call.name(), e.getMessage());
            }
        } else if (signature.isPresent() && !signature.get().isConstantFoldable()) {
            log.debug("Function {} is not constant foldable", call.name());
        }
        return new FunctionCall(call.name(), arguments, call.asMethod());
    }

    private Expression optimizeMath(MathOperation math) {
        Expression left = optimize(math.left());
        Expression right = optimize(math.right());
        MathOperation.Operator operator = math.operator();

        if (left instanceof NumberLiteral l && right instanceof NumberLiteral r) {
            // division by zero is left to the evaluator
            boolean divideByZero = r.value().doubleValue() == 0
                    && (operator == MathOperation.Operator.DIVIDE || operator == MathOperation.Operator.MODULO);
            if (!divideByZero) {
                return new NumberLiteral(operator.apply(l.value(), r.value()));
            }
        }

        // a - b parses as a + (0 - b)
        if (right instanceof MathOperation inner && inner.left().equals(NumberLiteral.ZERO)
                && isAdditive(operator) && isAdditive(inner.operator())) {
            boolean subtract = (operator == MathOperation.Operator.SUBTRACT)
                    ^ (inner.operator() == MathOperation.Operator.SUBTRACT);
            return new MathOperation(left, subtract ? MathOperation.Operator.SUBTRACT : MathOperation.Operator.ADD,
                    inner.right());
        }
        return new MathOperation(left, operator, right);
    }

    private static boolean isAdditive(MathOperation.Operator operator) {
        return operator == MathOperation.Operator.ADD || operator == MathOperation.Operator.SUBTRACT;
    }

    // ============================================================
    // Comparisons and sets
    // ============================================================

    private Expression optimizeComparison(Comparison comparison) {
        Expression left = optimize(comparison.left());
        Expression right = optimize(comparison.right());
        Comparison.Comparator comparator = comparison.comparator();

        if (left instanceof Literal l && right instanceof Literal r) {
            if (l.getClass() != r.getClass()) {
                return BooleanLiteral.of(comparator == Comparison.Comparator.NE);
            }
            return BooleanLiteral.of(comparator.test(compareLiterals(l, r)));
        }

        // assumes evaluating the same expression twice returns the same value
        if (left.equals(right)) {
            return BooleanLiteral.of(comparator == Comparison.Comparator.EQ
                    || comparator == Comparison.Comparator.LE
                    || comparator == Comparison.Comparator.GE);
        }
        return new Comparison(left, comparator, right);
    }

    private static int compareLiterals(Literal left, Literal right) {
        if (left instanceof StringLiteral l && right instanceof StringLiteral r) {
            return l.value().toLowerCase(Locale.ROOT).compareTo(r.value().toLowerCase(Locale.ROOT));
        } else if (left instanceof NumberLiteral l && right instanceof NumberLiteral r) {
            if (l.isIntegral() && r.isIntegral()) {
                return Long.compare(l.value().longValue(), r.value().longValue());
            }
            double a = l.value().doubleValue();
            double b = r.value().doubleValue();
            return a < b ? -1 : (a > b ? 1 : 0);
        } else if (left instanceof BooleanLiteral l && right instanceof BooleanLiteral r) {
            return Boolean.compare(l.value(), r.value());
        }
        return 0;
    }

    private Expression optimizeInSet(InSet inSet) {
        Expression expression = optimize(inSet.expression());
        ImmutableList<Expression> members = inSet.container().collect(this::optimize);

        // literals first, in their original order, then everything dynamic
        Map<LiteralKey, Literal> literals = literalValues(members);
        MutableList<Expression> dynamic = members.reject(Literal.class::isInstance).toList();
        MutableList<Expression> container = Lists.mutable.<Expression>withAll(literals.values()).withAll(dynamic);

        if (expression instanceof Literal literal) {
            if (literals.containsKey(LiteralKey.of(literal))) {
                return BooleanLiteral.TRUE;
            }
            container = dynamic;
        }

        if (container.isEmpty()) {
            return BooleanLiteral.FALSE;
        } else if (container.size() == 1) {
            return optimize(new Comparison(expression, Comparison.Comparator.EQ, container.get(0)));
        } else if (container.contains(expression)) {
            return BooleanLiteral.TRUE;
        }
        return new InSet(expression, container.toImmutable());
    }

    /**
     * Split a set with both literal and dynamic members into the union of a literal set and a dynamic set.
     */
    public Expression splitLiterals(InSet inSet) {
        if (inSet.isDynamic() || inSet.isLiteral()) {
            return inSet;
        }
        InSet literals = new InSet(inSet.expression(), inSet.container().select(Literal.class::isInstance));
        InSet dynamic = new InSet(inSet.expression(), inSet.container().reject(Literal.class::isInstance));
        return orWith(optimize(literals), optimize(dynamic));
    }

    private static Map<LiteralKey, Literal> literalValues(Iterable<Expression> container) {
        Map<LiteralKey, Literal> values = new LinkedHashMap<>();
        for (Expression member : container) {
            if (member instanceof Literal literal) {
                values.putIfAbsent(LiteralKey.of(literal), literal);
            }
        }
        return values;
    }

    private Expression intersect(InSet left, ImmutableList<Expression> right) {
        Map<LiteralKey, Literal> keep = literalValues(right);
        ImmutableList<Expression> reduced = Lists.immutable.<Expression>withAll(literalValues(left.container()).values())
                .select(value -> keep.containsKey(LiteralKey.of((Literal) value)));
        return optimize(new InSet(left.expression(), reduced));
    }

    private Expression subtract(InSet left, ImmutableList<Expression> right) {
        Map<LiteralKey, Literal> drop = literalValues(right);
        ImmutableList<Expression> reduced = Lists.immutable.<Expression>withAll(literalValues(left.container()).values())
                .reject(value -> drop.containsKey(LiteralKey.of((Literal) value)));
        return optimize(new InSet(left.expression(), reduced));
    }

    private Expression union(Expression expression, ImmutableList<Expression> left, ImmutableList<Expression> right) {
        Map<LiteralKey, Literal> values = literalValues(left);
        literalValues(right).forEach(values::putIfAbsent);
        return optimize(new InSet(expression, Lists.immutable.<Expression>withAll(values.values())));
    }

    // ============================================================
    // Boolean combinators
    // ============================================================

    /**
     * Boolean AND of two optimized expressions.
     */
    public Expression andWith(Expression left, Expression right) {
        if (left instanceof Literal l) {
            if (right instanceof Literal r) {
                return BooleanLiteral.of(l.isTruthy() && r.isTruthy());
            }
            return l.isTruthy() ? right : BooleanLiteral.FALSE;
        }
        if (right instanceof Literal r) {
            return r.isTruthy() ? left : BooleanLiteral.FALSE;
        }

        if (left instanceof And and) {
            return new And(and.terms().newWithAll(right instanceof And other ? other.terms() : Lists.immutable.of(right)));
        }

        if (left instanceof Comparison comparison && comparison.comparator() == Comparison.Comparator.EQ
                && comparison.right() instanceof Literal && right instanceof InSet inSet
                && inSet.isLiteral() && comparison.left().equals(inSet.expression())) {
            return intersect(new InSet(comparison.left(), Lists.immutable.of(comparison.right())), inSet.container());
        }

        if (left instanceof InSet inSet && inSet.isLiteral()) {
            if (right instanceof InSet other && other.isLiteral() && inSet.expression().equals(other.expression())) {
                return intersect(inSet, other.container());
            }
            if (right instanceof Not not && not.term() instanceof InSet other && other.isLiteral()
                    && inSet.expression().equals(other.expression())) {
                return subtract(inSet, other.container());
            }
            if (right instanceof Comparison comparison && comparison.right() instanceof Literal
                    && inSet.expression().equals(comparison.left())) {
                if (comparison.comparator() == Comparison.Comparator.EQ) {
                    return intersect(inSet, Lists.immutable.of(comparison.right()));
                } else if (comparison.comparator() == Comparison.Comparator.NE) {
                    return subtract(inSet, Lists.immutable.of(comparison.right()));
                }
            }
        }

        return new And(Lists.immutable.of(left).newWithAll(right instanceof And other ? other.terms() : Lists.immutable.of(right)));
    }

    /**
     * Boolean OR of two optimized expressions.
     */
    public Expression orWith(Expression left, Expression right) {
        if (left instanceof Literal l) {
            if (right instanceof Literal r) {
                return BooleanLiteral.of(l.isTruthy() || r.isTruthy());
            }
            return l.isTruthy() ? BooleanLiteral.TRUE : right;
        }
        if (right instanceof Literal r) {
            return r.isTruthy() ? BooleanLiteral.TRUE : left;
        }

        if (left instanceof Or or) {
            return new Or(or.terms().newWithAll(right instanceof Or other ? other.terms() : Lists.immutable.of(right)));
        }

        // one field compared to multiple values becomes a set
        if (left instanceof Comparison comparison && comparison.comparator() == Comparison.Comparator.EQ
                && comparison.right() instanceof Literal) {
            if (right instanceof Comparison other && other.comparator() == Comparison.Comparator.EQ
                    && other.right() instanceof Literal && comparison.left().equals(other.left())) {
                return union(comparison.left(), Lists.immutable.of(comparison.right()), Lists.immutable.of(other.right()));
            }
            if (right instanceof InSet inSet && inSet.isLiteral() && comparison.left().equals(inSet.expression())) {
                return union(comparison.left(), Lists.immutable.of(comparison.right()), inSet.container());
            }
        }

        if (left instanceof InSet inSet && inSet.isLiteral()) {
            if (right instanceof InSet other && other.isLiteral() && inSet.expression().equals(other.expression())) {
                return union(inSet.expression(), inSet.container(), other.container());
            }
            if (right instanceof Comparison comparison && comparison.comparator() == Comparison.Comparator.EQ
                    && comparison.right() instanceof Literal && inSet.expression().equals(comparison.left())) {
                return union(inSet.expression(), inSet.container(), Lists.immutable.of(comparison.right()));
            }
        }

        return new Or(Lists.immutable.of(left).newWithAll(right instanceof Or other ? other.terms() : Lists.immutable.of(right)));
    }

    /**
     * Boolean negation of an optimized expression.
     */
    public Expression negate(Expression term) {
        if (term instanceof Literal literal) {
            return BooleanLiteral.of(!literal.isTruthy());
        } else if (term instanceof Comparison comparison) {
            if (comparison.comparator() == Comparison.Comparator.EQ) {
                return optimize(new Comparison(comparison.left(), Comparison.Comparator.NE, comparison.right()));
            } else if (comparison.comparator() == Comparison.Comparator.NE) {
                return optimize(new Comparison(comparison.left(), Comparison.Comparator.EQ, comparison.right()));
            }
        } else if (term instanceof Not not) {
            return optimize(not.term());
        } else if (term instanceof And and) {
            return optimize(new Or(and.terms().collect(this::negate)));
        } else if (term instanceof Or or) {
            return optimize(new And(or.terms().collect(this::negate)));
        }
        return new Not(term);
    }

    private Expression optimizeAnd(And and) {
        if (and.terms().isEmpty()) {
            return BooleanLiteral.TRUE;
        }

        // nested terms of the same kind are folded one at a time
        ImmutableList<Expression> terms = and.terms().collect(this::optimize)
                .flatCollect(term -> term instanceof And nested ? nested.terms() : Lists.immutable.of(term));
        MutableList<Expression> merged = Lists.mutable.empty();
        Expression current = terms.get(0);
        for (Expression term : terms.castToList().subList(1, terms.size())) {
            current = andWith(current, term);
            if (current instanceof And compound) {
                merged.addAll(compound.terms().castToList().subList(0, compound.terms().size() - 1));
                current = compound.terms().getLast();
            } else if (current instanceof Literal literal && merged.notEmpty()) {
                if (!literal.isTruthy()) {
                    return BooleanLiteral.FALSE;
                }
                current = merged.remove(merged.size() - 1);
            }
        }

        if (merged.isEmpty()) {
            return current;
        }
        return new And(merged.with(current).toImmutable());
    }

    private Expression optimizeOr(Or or) {
        if (or.terms().isEmpty()) {
            return BooleanLiteral.FALSE;
        }

        // nested terms of the same kind are folded one at a time
        ImmutableList<Expression> terms = or.terms().collect(this::optimize)
                .flatCollect(term -> term instanceof Or nested ? nested.terms() : Lists.immutable.of(term));
        MutableList<Expression> merged = Lists.mutable.empty();
        Expression current = terms.get(0);
        for (Expression term : terms.castToList().subList(1, terms.size())) {
            current = orWith(current, term);
            if (current instanceof Or compound) {
                merged.addAll(compound.terms().castToList().subList(0, compound.terms().size() - 1));
                current = compound.terms().getLast();
            } else if (current instanceof Literal literal && merged.notEmpty()) {
                if (literal.isTruthy()) {
                    return BooleanLiteral.TRUE;
                }
                current = merged.remove(merged.size() - 1);
            }
        }

        if (merged.isEmpty()) {
            return current;
        }
        return new Or(merged.with(current).toImmutable());
    }

    /**
     * Identity of a literal within a set: strings compare case-insensitively, numbers numerically.
     */
    private record LiteralKey(Class<?> kind, Object value) {

        static LiteralKey of(Literal literal) {
            if (literal instanceof StringLiteral string) {
                return new LiteralKey(StringLiteral.class, string.value().toLowerCase(Locale.ROOT));
            } else if (literal instanceof NumberLiteral number) {
                return new LiteralKey(NumberLiteral.class, number.key());
            }
            return new LiteralKey(literal.getClass(), literal.value());
        }
    }
}
