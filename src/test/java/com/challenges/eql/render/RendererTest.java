package com.challenges.eql.render;

import com.challenges.eql.ast.And;
import com.challenges.eql.ast.Comparison;
import com.challenges.eql.ast.Constant;
import com.challenges.eql.ast.EqlAnalytic;
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
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RendererTest {

    private static final Field A = Field.of("a");
    private static final Field B = Field.of("b");
    private static final Field C = Field.of("c");

    private final Renderer renderer = new Renderer(FunctionRegistry.builtins());

    private static Literal.NumberLiteral num(long value) {
        return new Literal.NumberLiteral(value);
    }

    private static Literal.StringLiteral str(String value) {
        return new Literal.StringLiteral(value);
    }

    private static Comparison eq(Expression left, Expression right) {
        return new Comparison(left, Comparison.Comparator.EQ, right);
    }

    @Test
    public void testLiterals() {
        assertEquals("\"cmd.exe\"", renderer.render(str("cmd.exe")));
        assertEquals("1", renderer.render(num(1)));
        assertEquals("2.5", renderer.render(new Literal.NumberLiteral(2.5)));
        assertEquals("true", renderer.render(Literal.BooleanLiteral.TRUE));
        assertEquals("false", renderer.render(Literal.BooleanLiteral.FALSE));
        assertEquals("null", renderer.render(new Literal.NullLiteral()));
    }

    @Test
    public void testDecimalsRenderWithoutExponent() {
        assertEquals("2.0", renderer.render(new Literal.NumberLiteral(2.0)));
        assertEquals("0.0000001", renderer.render(new Literal.NumberLiteral(1e-7)));
        assertEquals("10000000000000000.0", renderer.render(new Literal.NumberLiteral(1e16)));
    }

    @Test
    public void testStringEscapes() {
        assertEquals("\"C:\\\\Windows\\\\\\\"x\\\"\\n\"", renderer.render(str("C:\\Windows\\\"x\"\n")));
        assertEquals("\"it\\'s\\t\"", renderer.render(str("it's\t")));
    }

    @Test
    public void testFields() {
        assertEquals("process_name", renderer.render(Field.of("process_name")));
        assertEquals("process.args[0].value", renderer.render(Field.of("process", "args", 0, "value")));
        assertEquals("events[1].pid", renderer.render(Field.of("events", 1, "pid")));
    }

    @ParameterizedTest
    @CsvSource({
            "30, 30s",
            "60, 1m",
            "90, 90s",
            "120, 2m",
            "150, 150s",
            "3600, 1h",
            "5400, 1.5h",
            "86400, 1d",
            "172800, 2d",
            "0.5, 0.5s",
            "0.0001, 0.0001s"
    })
    public void testTimeRange(double seconds, String expected) {
        assertEquals(expected, renderer.render(TimeRange.ofSeconds(seconds)));
    }

    @Test
    public void testComparison() {
        assertEquals("process_name == \"cmd.exe\"", renderer.render(eq(Field.of("process_name"), str("cmd.exe"))));
        assertEquals("a + b < 5", renderer.render(new Comparison(
                new MathOperation(A, MathOperation.Operator.ADD, B), Comparison.Comparator.LT, num(5))));
    }

    @Test
    public void testMathPrecedence() {
        MathOperation sum = new MathOperation(A, MathOperation.Operator.ADD, B);
        MathOperation product = new MathOperation(A, MathOperation.Operator.MULTIPLY, B);

        assertEquals("(a + b) * c", renderer.render(new MathOperation(sum, MathOperation.Operator.MULTIPLY, C)));
        assertEquals("a * b + c", renderer.render(new MathOperation(product, MathOperation.Operator.ADD, C)));
        assertEquals("c * (a + b)", renderer.render(new MathOperation(C, MathOperation.Operator.MULTIPLY, sum)));
        assertEquals("-a", renderer.render(new MathOperation(num(0), MathOperation.Operator.SUBTRACT, A)));
    }

    @Test
    public void testInlineAnd() {
        assertEquals("a == 1 and b == 2", renderer.render(And.of(eq(A, num(1)), eq(B, num(2)))));
    }

    @Test
    public void testSingleTermCompound() {
        assertEquals("a == 1", renderer.render(And.of(eq(A, num(1)))));
    }

    @Test
    public void testAndWithinOr() {
        Or or = Or.of(And.of(eq(A, num(1)), eq(B, num(2))), eq(C, num(3)));
        assertEquals("a == 1 and b == 2 or\n  c == 3", renderer.render(or));
    }

    @Test
    public void testOrWithinAnd() {
        And and = And.of(Or.of(eq(A, num(1)), eq(B, num(2))), eq(C, num(3)));
        assertEquals("(a == 1 or b == 2) and\n  c == 3", renderer.render(and));
    }

    @Test
    public void testManyTermsAreMultiLine() {
        And and = And.of(A, B, C, Field.of("d"), Field.of("e"));
        assertEquals("a and\n  b and\n  c and\n  d and\n  e", renderer.render(and));
    }

    @Test
    public void testNot() {
        assertEquals("not a", renderer.render(new Not(A)));
        assertEquals("not (a and b)", renderer.render(new Not(And.of(A, B))));
        assertEquals("not a == 1", renderer.render(new Not(eq(A, num(1)))));
        assertEquals("a and not b", renderer.render(And.of(A, new Not(B))));
    }

    @Test
    public void testNegatedSet() {
        assertEquals("a not in (\"x\", \"y\")", renderer.render(new Not(InSet.of(A, str("x"), str("y")))));
    }

    @Test
    public void testInlineSet() {
        assertEquals("process_name in (\"cmd.exe\", \"net.exe\", \"sc.exe\", \"at.exe\")",
                renderer.render(InSet.of(Field.of("process_name"),
                        str("cmd.exe"), str("net.exe"), str("sc.exe"), str("at.exe"))));
    }

    @Test
    public void testMultiLineSet() {
        InSet set = InSet.of(Field.of("process_name"),
                str("cmd.exe"), str("powershell.exe"), str("wscript.exe"), str("cscript.exe"));

        assertEquals("process_name in (\n"
                + "  \"cmd.exe\",\n"
                + "  \"powershell.exe\",\n"
                + "  \"wscript.exe\",\n"
                + "  \"cscript.exe\"\n"
                + ")", renderer.render(set));
    }

    @Test
    public void testSetWithinAndIsMultiLine() {
        And and = And.of(InSet.of(A, num(1), num(2)), eq(B, num(3)));
        assertEquals("a in (1, 2) and\n  b == 3", renderer.render(and));
    }

    @Test
    public void testFunctionCalls() {
        assertEquals("length(a)", renderer.render(FunctionCall.of("length", A)));
        assertEquals("concat(a, \"x\", 1)", renderer.render(FunctionCall.of("concat", A, str("x"), num(1))));
        assertEquals("unknownFunction()", renderer.render(FunctionCall.of("unknownFunction")));
    }

    @Test
    public void testMethodCall() {
        FunctionCall call = new FunctionCall("startsWith", Lists.immutable.of(A, str("x")), true);
        assertEquals("a:startsWith(\"x\")", renderer.render(call));
    }

    @Test
    public void testWildcardShorthand() {
        FunctionCall wildcard = FunctionCall.of("wildcard", Field.of("process_name"), str("*.exe"));

        assertEquals("process_name == \"*.exe\"", renderer.render(wildcard));
        assertEquals("process_name != \"*.exe\"", renderer.render(new Not(wildcard)));
        assertEquals("wildcard(process_name, \"a*\", \"b*\")",
                renderer.render(FunctionCall.of("wildcard", Field.of("process_name"), str("a*"), str("b*"))));
    }

    @Test
    public void testWildcardShorthandWithoutRegistry() {
        Renderer plain = new Renderer(FunctionRegistry.empty());
        FunctionCall wildcard = FunctionCall.of("wildcard", A, str("*.exe"));

        assertEquals("wildcard(a, \"*.exe\")", plain.render(wildcard));
    }

    @Test
    public void testNamedSubquery() {
        NamedSubquery subquery = new NamedSubquery(NamedSubquery.QueryType.DESCENDANT,
                new EventQuery("process", eq(A, num(1))));
        assertEquals("descendant of [process where a == 1]", renderer.render(subquery));
    }

    @Test
    public void testEventQuery() {
        assertEquals("process where a == 1", renderer.render(new EventQuery("process", eq(A, num(1)))));
        assertEquals("process where\n  a == 1 or\n    b", renderer.render(
                new EventQuery("process", Or.of(eq(A, num(1)), Or.of(B)))));
    }

    @Test
    public void testSequence() {
        Map<String, Expression> params = new LinkedHashMap<>();
        params.put("maxspan", TimeRange.ofSeconds(300));
        Sequence sequence = new Sequence(
                Lists.immutable.of(
                        new SubqueryBy(new EventQuery("process", eq(A, num(1))), null,
                                Lists.immutable.of(Field.of("pid"))),
                        new SubqueryBy(new EventQuery("network", Literal.BooleanLiteral.TRUE), null,
                                Lists.immutable.of(Field.of("pid")))),
                new NamedParams(params),
                new SubqueryBy(new EventQuery("process", eq(B, num(2)))));

        assertEquals("sequence with maxspan=5m\n"
                + "  [process where a == 1] by pid\n"
                + "  [network where true] by pid\n"
                + "until\n"
                + "  [process where b == 2]", renderer.render(sequence));
    }

    @Test
    public void testSequenceWithoutParams() {
        Sequence sequence = new Sequence(Lists.immutable.of(
                new SubqueryBy(new EventQuery("file", A)),
                new SubqueryBy(new EventQuery("network", B))));

        assertEquals("sequence\n  [file where a]\n  [network where b]", renderer.render(sequence));
    }

    @Test
    public void testSubqueryParams() {
        Map<String, Expression> params = new LinkedHashMap<>();
        params.put("fork", Literal.BooleanLiteral.TRUE);
        SubqueryBy subquery = new SubqueryBy(new EventQuery("process", A), new NamedParams(params),
                Lists.immutable.of(Field.of("pid"), Field.of("ppid")));

        assertEquals("[process where a] fork=true by pid, ppid", renderer.render(subquery));
    }

    @Test
    public void testJoin() {
        Join join = new Join(Lists.immutable.of(
                new SubqueryBy(new EventQuery("file", A)),
                new SubqueryBy(new EventQuery("network", B))));

        assertEquals("join\n  [file where a]\n  [network where b]", renderer.render(join));
    }

    @Test
    public void testPipedQuery() {
        PipedQuery query = new PipedQuery(new EventQuery("process", Literal.BooleanLiteral.TRUE),
                Lists.immutable.of(PipeCommand.of("unique", A, B), PipeCommand.of("count")));

        assertEquals("process where true\n| unique a, b\n| count", renderer.render(query));
        assertEquals("process where true\n| unique a, b\n| count", renderer.render(new EqlAnalytic(query)));
    }

    @Test
    public void testConstant() {
        assertEquals("const MAX = 10", renderer.render(new Constant("MAX", num(10))));
    }

    @Test
    public void testInlineMacro() {
        Macro macro = new Macro("IsCmd", Lists.immutable.of("x"), eq(Field.of("x"), str("cmd.exe")));
        assertEquals("macro IsCmd(x) x == \"cmd.exe\"", renderer.render(macro));
    }

    @Test
    public void testMultiLineMacro() {
        Macro macro = new Macro("M", Lists.immutable.of("a", "b"),
                Or.of(eq(A, str("aaaaaaaaaaaa")), eq(B, str("bbbbbbbbbbbb"))));

        assertEquals("macro M(a, b) \n  a == \"aaaaaaaaaaaa\" or b == \"bbbbbbbbbbbb\"", renderer.render(macro));
    }

    @Test
    public void testIndentStripsTrailingWhitespace() {
        assertEquals("  a\n\n  b", Renderer.indent("a  \n\nb"));
    }

    @Test
    public void testPrecedenceRanks() {
        assertEquals(Precedence.LITERAL, Precedence.of(A));
        assertEquals(Precedence.FUNCTION_CALL, Precedence.of(FunctionCall.of("length", A)));
        assertEquals(Precedence.MULTIPLICATIVE, Precedence.of(new MathOperation(A, MathOperation.Operator.MODULO, B)));
        assertEquals(Precedence.ADDITIVE, Precedence.of(new MathOperation(A, MathOperation.Operator.SUBTRACT, B)));
        assertEquals(Precedence.OR, Precedence.of(Or.of(A, B)));
        assertNull(Precedence.of(new EventQuery("process", A)));
    }

    @Test
    public void testUnescapeInvertsEscape() {
        String text = "a\\b\"c'\t\r\n\f\bd";
        assertEquals(text, StringEscapes.unescape(StringEscapes.escape(text)));
        assertEquals("\\q", StringEscapes.unescape("\\q"));
        assertEquals("plain", StringEscapes.escape("plain"));
    }
}
