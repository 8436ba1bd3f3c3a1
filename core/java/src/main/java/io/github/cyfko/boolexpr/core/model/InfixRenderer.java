package io.github.cyfko.boolexpr.core.model;

/**
 * Renders expressions in a human-readable infix notation for logs and assertion messages.
 * <p>
 * This notation is not parsed back: the interchange format is the JSON grammar handled by
 * {@link io.github.cyfko.boolexpr.core.parsing.JsonExpressionCodec}.
 * </p>
 */
final class InfixRenderer {

    private static final String TRUE_SYMBOL = "⊤";
    private static final String FALSE_SYMBOL = "⊥";

    private InfixRenderer() {}

    static String render(BooleanExpression expression) {
        StringBuilder sb = new StringBuilder();
        append(expression, sb);
        return sb.toString();
    }

    private static void append(BooleanExpression expression, StringBuilder sb) {
        switch (expression.type()) {
            case TRUE -> sb.append(TRUE_SYMBOL);
            case FALSE -> sb.append(FALSE_SYMBOL);
            case VARIABLE -> sb.append(((Variable) expression).name());
            case NOT -> {
                sb.append('¬');
                append(((Not) expression).operand(), sb);
            }
            case OR -> {
                Or or = (Or) expression;
                appendBinary(or.left(), " ∨ ", or.right(), sb);
            }
            case AND -> {
                And and = (And) expression;
                appendBinary(and.left(), " ∧ ", and.right(), sb);
            }
        }
    }

    private static void appendBinary(BooleanExpression left, String symbol, BooleanExpression right, StringBuilder sb) {
        sb.append('(');
        append(left, sb);
        sb.append(symbol);
        append(right, sb);
        sb.append(')');
    }
}
