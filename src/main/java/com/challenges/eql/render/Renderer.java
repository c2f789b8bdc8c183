package com.challenges.eql.render;

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
import com.challenges.eql.ast.Sequence;
import com.challenges.eql.ast.SubqueryBy;
import com.challenges.eql.ast.TimeRange;
import com.challenges.eql.functions.FunctionRegistry;
import com.challenges.eql.functions.FunctionSignature;
import com.challenges.eql.functions.Wildcard;
import org.eclipse.collections.api.list.ImmutableList;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Converts nodes back to canonical source text, adding the parentheses required by {@link Precedence}.
 */
public class Renderer {

    static final String TAB = "  ";

    private static final int MAX_INLINE_SET_SIZE = 3;
    private static final int MAX_INLINE_SET_LENGTH = 40;
    private static final int MAX_INLINE_TERMS = 4;
    private static final int MAX_INLINE_MACRO_LENGTH = 40;

    private final FunctionRegistry functions;

    public Renderer(FunctionRegistry functions) {
        this.functions = functions;
    }

    public String render(EqlNode node) {
        return render(node, null);
    }

    /**
     * Render a node within a context of the given rank.
     *
     * @param precedence rank of the enclosing node, or null at the top level
     */
    public String render(EqlNode node, Integer precedence) {
        if (node instanceof FunctionCall call) {
            return renderFunctionCall(call, precedence);
        } else if (node instanceof Not not) {
            return renderNot(not, precedence);
        } else if (node instanceof InSet set) {
            return wrap(set, renderInSet(set, false), precedence);
        }
        return wrap(node, renderBody(node), precedence);
    }

    /**
     * Indent every line of the text by one level, stripping trailing whitespace.
     */
    public static String indent(String text) {
        return text.lines()
                .map(line -> (TAB + line).stripTrailing())
                .collect(Collectors.joining("\n"));
    }

    private static String wrap(EqlNode node, String rendered, Integer precedence) {
        Integer own = Precedence.of(node);
        if (precedence != null && own != null && own > precedence) {
            return "(" + rendered + ")";
        }
        return rendered;
    }

    private String renderBody(EqlNode node) {
        if (node instanceof Literal literal) {
            return renderLiteral(literal);
        } else if (node instanceof TimeRange range) {
            return renderTimeRange(range);
        } else if (node instanceof Field field) {
            return renderField(field);
        } else if (node instanceof NamedSubquery subquery) {
            return subquery.queryType().keyword() + " of [" + render(subquery.query(), Precedence.FUNCTION_CALL) + "]";
        } else if (node instanceof MathOperation math) {
            return renderMath(math);
        } else if (node instanceof Comparison comparison) {
            int rank = Precedence.COMPARISON;
            return render(comparison.left(), rank) + " " + comparison.comparator().symbol() + " "
                    + render(comparison.right(), rank);
        } else if (node instanceof And and) {
            return renderCompound(and.terms(), Precedence.AND, "and");
        } else if (node instanceof Or or) {
            return renderCompound(or.terms(), Precedence.OR, "or");
        } else if (node instanceof EventQuery query) {
            return renderEventQuery(query);
        } else if (node instanceof NamedParams params) {
            return renderParams(params);
        } else if (node instanceof SubqueryBy subquery) {
            return renderSubqueryBy(subquery);
        } else if (node instanceof Join join) {
            return "join\n" + renderSubqueries(join.queries(), join.close());
        } else if (node instanceof Sequence sequence) {
            return renderSequence(sequence);
        } else if (node instanceof PipeCommand pipe) {
            return renderPipe(pipe);
        } else if (node instanceof PipedQuery piped) {
            StringBuilder sb = new StringBuilder(render(piped.first()));
            for (PipeCommand pipe : piped.pipes()) {
                sb.append("\n| ").append(render(pipe));
            }
            return sb.toString();
        } else if (node instanceof EqlAnalytic analytic) {
            return render(analytic.query());
        } else if (node instanceof Constant constant) {
            return "const " + constant.name() + " = " + render(constant.value());
        } else if (node instanceof Macro macro) {
            return renderMacro(macro);
        }
        throw new IllegalStateException("Unable to render " + node.getClass().getSimpleName());
    }

    private String renderLiteral(Literal literal) {
        if (literal instanceof Literal.StringLiteral string) {
            return "\"" + StringEscapes.escape(string.value()) + "\"";
        } else if (literal instanceof Literal.BooleanLiteral bool) {
            return bool.value() ? "true" : "false";
        } else if (literal instanceof Literal.NumberLiteral number) {
            if (number.value() instanceof Double d && Double.isFinite(d)) {
                String plain = plainDecimal(d);
                return plain.indexOf('.') < 0 ? plain + ".0" : plain;
            }
            return number.value().toString();
        }
        return "null";
    }

    // no exponent notation, the query grammar has none
    private static String plainDecimal(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String renderTimeRange(TimeRange range) {
        double interval = range.totalSeconds();
        double second = 1;
        double minute = 60 * second;
        double hour = 60 * minute;
        double day = 24 * hour;
        double decimal = interval;
        String unit = "s";

        if (interval >= day) {
            decimal = interval / day;
            unit = "d";
        } else if (interval >= hour) {
            decimal = interval / hour;
            unit = "h";
        } else if (interval >= minute) {
            if (interval % minute == 0 || interval % second != 0) {
                decimal = interval / minute;
                unit = "m";
            }
        }

        if (decimal == Math.rint(decimal)) {
            return (long) decimal + unit;
        }
        return plainDecimal(decimal) + unit;
    }

    private static String renderField(Field field) {
        StringBuilder sb = new StringBuilder(field.base());
        for (Object key : field.path()) {
            if (key instanceof Integer index) {
                sb.append('[').append(index).append(']');
            } else {
                sb.append('.').append(key);
            }
        }
        return sb.toString();
    }

    private String renderFunctionCall(FunctionCall call, Integer precedence) {
        Optional<FunctionSignature> signature = functions.lookup(call.name());
        if (signature.isPresent()) {
            Optional<String> alternate = signature.get()
                    .alternateRender(call.arguments().castToList(), precedence, this);
            if (alternate.isPresent()) {
                return alternate.get();
            }
        }

        // never parenthesized
        int rank = Precedence.FUNCTION_CALL;
        ImmutableList<Expression> arguments = call.arguments();
        if (call.asMethod() && arguments.notEmpty()) {
            return render(arguments.getFirst(), rank) + ":" + call.name() + "("
                    + joinRendered(arguments.drop(1), rank) + ")";
        }
        return call.name() + "(" + joinRendered(arguments, rank) + ")";
    }

    private String renderNot(Not not, Integer precedence) {
        Expression term = not.term();
        if (term instanceof InSet set) {
            return wrap(set, renderInSet(set, true), precedence);
        }
        if (term instanceof FunctionCall call && Wildcard.NAME.equals(call.name())
                && call.arguments().size() == 2 && call.arguments().get(1) instanceof Literal.StringLiteral) {
            Comparison comparison = new Comparison(call.arguments().get(0), Comparison.Comparator.NE,
                    call.arguments().get(1));
            return render(comparison, precedence);
        }
        return wrap(not, "not " + render(term, Precedence.NOT), precedence);
    }

    private String renderInSet(InSet set, boolean negate) {
        ImmutableList<String> values = set.container().collect(value -> render(value));
        String lhs = render(set.expression(), Precedence.COMPARISON);
        String operator = negate ? "not in" : "in";

        long totalLength = values.sumOfInt(String::length);
        if (values.size() > MAX_INLINE_SET_SIZE && totalLength > MAX_INLINE_SET_LENGTH) {
            return lhs + " " + operator + " (\n" + indent(values.makeString(",\n")) + "\n)";
        }
        return lhs + " " + operator + " (" + values.makeString(", ") + ")";
    }

    private String renderMath(MathOperation math) {
        int rank = Precedence.of(math);
        String right = render(math.right(), rank);
        String operator = math.operator().symbol();
        if (Literal.NumberLiteral.ZERO.equals(math.left())) {
            return operator + right;
        }
        return render(math.left(), rank) + " " + operator + " " + right;
    }

    private String renderCompound(ImmutableList<Expression> terms, int rank, String operator) {
        ImmutableList<String> scoped = terms.collect(term -> render(term, rank));
        if (scoped.size() == 1) {
            return scoped.getFirst();
        }

        boolean multiline = terms.size() > MAX_INLINE_TERMS
                || terms.anySatisfy(term -> term instanceof And || term instanceof Or
                || term instanceof NamedSubquery || term instanceof InSet);
        if (multiline) {
            return scoped.collect(Renderer::indent).makeString(" " + operator + "\n").stripLeading();
        }
        return scoped.makeString(" " + operator + " ").stripLeading();
    }

    private String renderEventQuery(EventQuery query) {
        String condition = render(query.query());
        if (condition.contains("\n")) {
            return query.eventType() + " where\n" + indent(condition);
        }
        return query.eventType() + " where " + condition;
    }

    private String renderParams(NamedParams params) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Expression> entry : params.kv().entrySet()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(entry.getKey()).append('=').append(render(entry.getValue(), Precedence.LITERAL));
        }
        return sb.toString();
    }

    private String renderSubqueryBy(SubqueryBy subquery) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(render(subquery.query())).append(']');
        String params = render(subquery.params());
        if (!params.isEmpty()) {
            sb.append(' ').append(params);
        }
        if (subquery.joinValues().notEmpty()) {
            sb.append(" by ").append(joinRendered(subquery.joinValues(), null));
        }
        return sb.toString();
    }

    private String renderSequence(Sequence sequence) {
        StringBuilder sb = new StringBuilder("sequence");
        String params = render(sequence.params());
        if (!params.isEmpty()) {
            sb.append(" with ").append(params);
        }
        sb.append('\n').append(renderSubqueries(sequence.queries(), sequence.close()));
        return sb.toString();
    }

    private String renderSubqueries(ImmutableList<SubqueryBy> queries, SubqueryBy close) {
        String text = indent(queries.collect(query -> render(query)).makeString("\n"));
        if (close != null) {
            text += "\nuntil\n" + indent(render(close));
        }
        return text;
    }

    private String renderPipe(PipeCommand pipe) {
        if (pipe.arguments().isEmpty()) {
            return pipe.name();
        }
        return pipe.name() + " " + joinRendered(pipe.arguments(), null);
    }

    private String renderMacro(Macro macro) {
        String parameters = macro.parameters().makeString(", ");
        String body = render(macro.expression());
        if (body.contains("\n") || body.length() > MAX_INLINE_MACRO_LENGTH) {
            return "macro " + macro.name() + "(" + parameters + ") \n" + indent(body);
        }
        return "macro " + macro.name() + "(" + parameters + ") " + body;
    }

    private String joinRendered(ImmutableList<? extends EqlNode> nodes, Integer precedence) {
        return nodes.collect(node -> render(node, precedence)).makeString(", ");
    }
}
