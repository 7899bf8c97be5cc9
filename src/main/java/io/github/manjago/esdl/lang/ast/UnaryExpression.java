package io.github.manjago.esdl.lang.ast;

import io.github.manjago.esdl.lang.SourceLocation;

public record UnaryExpression(Operator operator, Expression operand, SourceLocation location) implements Expression {

    public enum Operator {
        NEGATE("-"),
        NOT("not ");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    @Override
    public String toString() {
        return operator.getSymbol() + operand;
    }
}
