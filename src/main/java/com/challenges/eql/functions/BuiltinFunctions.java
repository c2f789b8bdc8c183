package com.challenges.eql.functions;

import com.challenges.eql.ast.MathOperation;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.Locale;
import java.util.function.BiPredicate;

/**
 * Functions known to every registry created with {@link FunctionRegistry#builtins()}.
 */
public final class BuiltinFunctions {

    private BuiltinFunctions() {
    }

    public static MutableList<FunctionSignature> all() {
        MutableList<FunctionSignature> signatures = Lists.mutable.empty();
        for (MathOperation.Operator operator : MathOperation.Operator.values()) {
            signatures.add(new MathFunction(operator));
        }
        signatures.add(new Length());
        signatures.add(new Concat());
        signatures.add(new StringPredicate("startsWith", String::startsWith));
        signatures.add(new StringPredicate("endsWith", String::endsWith));
        signatures.add(new StringPredicate("stringContains", String::contains));
        signatures.add(new Wildcard());
        return signatures;
    }

    /**
     * Named form of a math operator, e.g. {@code add(a, b)}.
     */
    record MathFunction(MathOperation.Operator operator) implements FunctionSignature {

        @Override
        public String name() {
            return operator.functionName();
        }

        @Override
        public Object evaluate(List<Object> arguments) {
            if (arguments.size() != 2
                    || !(arguments.get(0) instanceof Number left)
                    || !(arguments.get(1) instanceof Number right)) {
                throw new UnsupportedConstantEvaluationException(name(), "expected two numbers");
            }
            if (operator.isMultiplicative() && operator != MathOperation.Operator.MULTIPLY
                    && right.doubleValue() == 0) {
                throw new UnsupportedConstantEvaluationException(name(), "division by zero");
            }
            return operator.apply(left, right);
        }
    }

    record Length() implements FunctionSignature {

        @Override
        public String name() {
            return "length";
        }

        @Override
        public Object evaluate(List<Object> arguments) {
            if (arguments.size() != 1) {
                throw new UnsupportedConstantEvaluationException(name(), "expected one argument");
            }
            Object value = arguments.get(0);
            if (value instanceof String text) {
                return text.length();
            } else if (value == null) {
                return 0;
            }
            throw new UnsupportedConstantEvaluationException(name(), "expected a string");
        }
    }

    record Concat() implements FunctionSignature {

        @Override
        public String name() {
            return "concat";
        }

        @Override
        public Object evaluate(List<Object> arguments) {
            StringBuilder sb = new StringBuilder();
            for (Object value : arguments) {
                if (value != null) {
                    sb.append(value);
                }
            }
            return sb.toString();
        }
    }

    /**
     * Case-insensitive test between two strings, false if either is not a string.
     */
    record StringPredicate(String name, BiPredicate<String, String> test) implements FunctionSignature {

        @Override
        public Object evaluate(List<Object> arguments) {
            if (arguments.size() != 2) {
                throw new UnsupportedConstantEvaluationException(name, "expected two arguments");
            }
            if (arguments.get(0) instanceof String source && arguments.get(1) instanceof String substring) {
                return test.test(source.toLowerCase(Locale.ROOT), substring.toLowerCase(Locale.ROOT));
            }
            return false;
        }
    }
}
