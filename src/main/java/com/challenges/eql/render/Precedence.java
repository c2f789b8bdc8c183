package com.challenges.eql.render;

import com.challenges.eql.ast.And;
import com.challenges.eql.ast.Comparison;
import com.challenges.eql.ast.EqlNode;
import com.challenges.eql.ast.Expression;
import com.challenges.eql.ast.Field;
import com.challenges.eql.ast.FunctionCall;
import com.challenges.eql.ast.InSet;
import com.challenges.eql.ast.Literal;
import com.challenges.eql.ast.MathOperation;
import com.challenges.eql.ast.NamedSubquery;
import com.challenges.eql.ast.Not;
import com.challenges.eql.ast.Or;
import com.challenges.eql.ast.TimeRange;

/**
 * Orders of operation used to decide where parentheses go. A child is wrapped when its rank is greater than the
 * rank of its context.
 */
public final class Precedence {

    public static final int EXPRESSION = 0;
    public static final int LITERAL = EXPRESSION + 1;
    public static final int FUNCTION_CALL = LITERAL + 1;
    public static final int MULTIPLICATIVE = FUNCTION_CALL + 1;
    public static final int ADDITIVE = MULTIPLICATIVE + 1;
    public static final int COMPARISON = ADDITIVE + 1;
    public static final int NOT = COMPARISON + 1;
    public static final int AND = NOT + 1;
    public static final int OR = AND + 1;

    private Precedence() {
    }

    /**
     * Rank of a node, or null for queries, pipes and other nodes that are never parenthesized.
     */
    public static Integer of(EqlNode node) {
        if (node instanceof Literal || node instanceof TimeRange || node instanceof Field) {
            return LITERAL;
        } else if (node instanceof FunctionCall || node instanceof NamedSubquery) {
            return FUNCTION_CALL;
        } else if (node instanceof MathOperation math) {
            return math.operator().isMultiplicative() ? MULTIPLICATIVE : ADDITIVE;
        } else if (node instanceof Comparison || node instanceof InSet) {
            return COMPARISON;
        } else if (node instanceof Not) {
            return NOT;
        } else if (node instanceof And) {
            return AND;
        } else if (node instanceof Or) {
            return OR;
        } else if (node instanceof Expression) {
            return EXPRESSION;
        }
        return null;
    }
}
