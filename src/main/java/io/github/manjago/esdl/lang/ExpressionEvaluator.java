package io.github.manjago.esdl.lang;

import io.github.manjago.esdl.lang.ast.BinaryExpression;
import io.github.manjago.esdl.lang.ast.Expression;
import io.github.manjago.esdl.lang.ast.Literal;
import io.github.manjago.esdl.lang.ast.NameRef;
import io.github.manjago.esdl.lang.ast.UnaryExpression;

/**
 * Evaluates restricted expressions.
 * <p>
 * Values are {@code Long}, {@code Double}, {@code String} or {@code Boolean}.
 * Integer arithmetic stays integral except for {@code /} and {@code ^}, which always
 * give a real. {@code %} is a floored modulo. {@code and}/{@code or} short-circuit.
 * There is no way to call anything, so evaluation cannot run code.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {
    }

    public static Object evaluate(Expression expression, VariableScope scope) throws EvaluationException {
        if (expression instanceof Literal literal) {
            return literal.value();
        }
        if (expression instanceof NameRef ref) {
            return scope.lookup(ref.name())
                    .orElseThrow(() -> new EvaluationException("Unknown name '" + ref.name() + "'", ref.location()));
        }
        if (expression instanceof UnaryExpression unary) {
            return unary(unary, scope);
        }
        if (expression instanceof BinaryExpression binary) {
            return binary(binary, scope);
        }
        throw new IllegalArgumentException("Unsupported expression: " + expression.getClass().getSimpleName());
    }

    // ========== Typed helpers ==========

    public static long evaluateLong(Expression expression, VariableScope scope) throws EvaluationException {
        return toLong(evaluate(expression, scope), expression.location());
    }

    public static double evaluateDouble(Expression expression, VariableScope scope) throws EvaluationException {
        return toDouble(evaluate(expression, scope), expression.location());
    }

    public static long toLong(Object value, SourceLocation location) throws EvaluationException {
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
            return d.longValue();
        }
        throw new EvaluationException("Expected an integer, got " + describe(value), location);
    }

    public static double toDouble(Object value, SourceLocation location) throws EvaluationException {
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Double d) {
            return d;
        }
        throw new EvaluationException("Expected a number, got " + describe(value), location);
    }

    public static boolean toBoolean(Object value, SourceLocation location) throws EvaluationException {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new EvaluationException("Expected true or false, got " + describe(value), location);
    }

    public static String describe(Object value) {
        if (value instanceof String s) {
            return "string \"" + s + "\"";
        }
        return String.valueOf(value);
    }

    // ========== Operators ==========

    private static Object unary(UnaryExpression unary, VariableScope scope) throws EvaluationException {
        Object operand = evaluate(unary.operand(), scope);
        if (unary.operator() == UnaryExpression.Operator.NOT) {
            return !toBoolean(operand, unary.location());
        }
        if (operand instanceof Long l) {
            if (l == Long.MIN_VALUE) {
                throw new EvaluationException("Integer overflow in -" + l, unary.location());
            }
            return -l;
        }
        return -toDouble(operand, unary.location());
    }

    private static Object binary(BinaryExpression binary, VariableScope scope) throws EvaluationException {
        SourceLocation at = binary.location();
        BinaryExpression.Operator op = binary.operator();

        if (op == BinaryExpression.Operator.AND) {
            return toBoolean(evaluate(binary.left(), scope), at) && toBoolean(evaluate(binary.right(), scope), at);
        }
        if (op == BinaryExpression.Operator.OR) {
            return toBoolean(evaluate(binary.left(), scope), at) || toBoolean(evaluate(binary.right(), scope), at);
        }

        Object left = evaluate(binary.left(), scope);
        Object right = evaluate(binary.right(), scope);

        switch (op) {
            case EQUAL:
                return equal(left, right);
            case NOT_EQUAL:
                return !equal(left, right);
            case ADD:
                if (left instanceof String || right instanceof String) {
                    if (left instanceof String l && right instanceof String r) {
                        return l + r;
                    }
                    throw new EvaluationException("Cannot add " + describe(left) + " and " + describe(right), at);
                }
                break;
            default:
                break;
        }

        if (left instanceof Long l && right instanceof Long r) {
            try {
                switch (op) {
                    case ADD:
                        return Math.addExact(l, r);
                    case SUBTRACT:
                        return Math.subtractExact(l, r);
                    case MULTIPLY:
                        return Math.multiplyExact(l, r);
                    default:
                        break;
                }
            } catch (ArithmeticException e) {
                throw new EvaluationException("Integer overflow in " + l + " " + op.getSymbol() + " " + r, at);
            }
            switch (op) {
                case MODULO:
                    if (r == 0) {
                        throw new EvaluationException("Modulo by zero", at);
                    }
                    return Math.floorMod(l, r);
                default:
                    break;
            }
        }

        double a = toDouble(left, at);
        double b = toDouble(right, at);
        return switch (op) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> {
                if (b == 0.0) {
                    throw new EvaluationException("Division by zero", at);
                }
                yield a / b;
            }
            case MODULO -> {
                if (b == 0.0) {
                    throw new EvaluationException("Modulo by zero", at);
                }
                yield a - b * Math.floor(a / b);
            }
            case POWER -> Math.pow(a, b);
            case LESS -> a < b;
            case LESS_EQUAL -> a <= b;
            case GREATER -> a > b;
            case GREATER_EQUAL -> a >= b;
            default -> throw new IllegalStateException("Unhandled operator " + op);
        };
    }

    private static boolean equal(Object left, Object right) {
        if ((left instanceof Long || left instanceof Double) && (right instanceof Long || right instanceof Double)) {
            return ((Number) left).doubleValue() == ((Number) right).doubleValue();
        }
        return left.equals(right);
    }
}
