package com.ember.script.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in {@link ExpressionHost}.
 *
 * Values are Boolean, Double or String. Bare words evaluate to their own text, {@code =} compares like
 * {@code ==}, and calls go to the registered {@link ScriptFunctions}. Ordering comparisons and arithmetic
 * other than {@code +} need numeric operands.
 */
public final class DefaultExpressionHost implements ExpressionHost {

    private final ScriptFunctions functions;

    public DefaultExpressionHost(ScriptFunctions functions) {
        this.functions = functions;
    }

    @Override
    public ExpressionResult evaluate(String text) throws ExpressionException {
        if (text == null || text.trim().isEmpty()) throw new ExpressionException("Empty expression");
        try {
            HostExpr.Node expr = new HostParser(new HostLexer(text).tokenize()).parse();
            Evaluator evaluator = new Evaluator();
            Object value = expr.accept(evaluator);
            return ExpressionResult.withGroups(value, evaluator.groups);
        } catch (RuntimeException e) {
            throw new ExpressionException("Failed to evaluate '" + text + "': " + e.getMessage(), e);
        }
    }

    // ===================== EVALUATION =====================

    private final class Evaluator implements HostExpr.Visitor<Object> {
        /** Groups of the last function call that captured any. */
        private List<String> groups = new ArrayList<>();

        @Override
        public Object visitLiteral(HostExpr.Literal expr) {
            return expr.value;
        }

        @Override
        public Object visitUnary(HostExpr.Unary expr) throws ExpressionException {
            Object right = expr.right.accept(this);
            if (expr.operator.type == HostTokenType.BANG) return !isTruthy(right);
            return -requireNumber(right, expr.operator);
        }

        @Override
        public Object visitLogical(HostExpr.Logical expr) throws ExpressionException {
            boolean left = isTruthy(expr.left.accept(this));
            if (expr.operator.type == HostTokenType.OR_OR) {
                if (left) return true;
            } else if (!left) {
                return false;
            }
            return isTruthy(expr.right.accept(this));
        }

        @Override
        public Object visitBinary(HostExpr.Binary expr) throws ExpressionException {
            Object left = expr.left.accept(this);
            Object right = expr.right.accept(this);
            HostToken op = expr.operator;

            switch (op.type) {
                case PLUS: {
                    Double l = asNumber(left);
                    Double r = asNumber(right);
                    if (l != null && r != null) return l + r;
                    return stringify(left) + stringify(right);
                }
                case MINUS:
                    return requireNumber(left, op) - requireNumber(right, op);
                case STAR:
                    return requireNumber(left, op) * requireNumber(right, op);
                case SLASH: {
                    double divisor = requireNumber(right, op);
                    if (divisor == 0) throw new ExpressionException("Division by zero");
                    return requireNumber(left, op) / divisor;
                }
                case PERCENT: {
                    double divisor = requireNumber(right, op);
                    if (divisor == 0) throw new ExpressionException("Division by zero");
                    return requireNumber(left, op) % divisor;
                }

                case GREATER:
                    return requireNumber(left, op) > requireNumber(right, op);
                case GREATER_EQUAL:
                    return requireNumber(left, op) >= requireNumber(right, op);
                case LESS:
                    return requireNumber(left, op) < requireNumber(right, op);
                case LESS_EQUAL:
                    return requireNumber(left, op) <= requireNumber(right, op);

                case EQUAL_EQUAL:
                    return isEqual(left, right);
                case BANG_EQUAL:
                    return !isEqual(left, right);

                default:
                    throw new ExpressionException("Unsupported binary operator: " + op.lexeme);
            }
        }

        @Override
        public Object visitCall(HostExpr.Call expr) throws ExpressionException {
            List<String> args = new ArrayList<>();
            for (HostExpr.Node argument : expr.arguments) {
                args.add(stringify(argument.accept(this)));
            }
            ExpressionResult result = functions.call(expr.name, args);
            if (!result.groups().isEmpty()) groups = result.groups();
            return result.value();
        }
    }

    // -------------------------
    // Value helpers
    // -------------------------

    private static Double asNumber(Object value) {
        if (value instanceof Double) return (Double) value;
        if (value instanceof String) return Numbers.parse((String) value);
        return null;
    }

    private static double requireNumber(Object value, HostToken op) throws ExpressionException {
        Double number = asNumber(value);
        if (number == null) {
            throw new ExpressionException("Operand of '" + op.lexeme + "' must be a number: " + stringify(value));
        }
        return number;
    }

    private static boolean isTruthy(Object value) {
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Double) return (Double) value != 0;
        return Boolean.TRUE.equals(Numbers.toBool(stringify(value)));
    }

    private static boolean isEqual(Object left, Object right) {
        Double l = asNumber(left);
        Double r = asNumber(right);
        if (l != null && r != null) return l.doubleValue() == r.doubleValue();

        if (left instanceof Boolean || right instanceof Boolean) {
            Boolean lb = left instanceof Boolean ? (Boolean) left : Numbers.toBool(stringify(left));
            Boolean rb = right instanceof Boolean ? (Boolean) right : Numbers.toBool(stringify(right));
            return lb != null && lb.equals(rb);
        }
        return stringify(left).equals(stringify(right));
    }

    private static String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof Double) return Numbers.format((Double) value);
        return value.toString();
    }
}
