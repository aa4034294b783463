package ai.proofkit.extractor.expression;

import java.util.Objects;
import java.util.SortedSet;

public record UnaryOperation(Operator operator, SymbolicExpression operand) implements SymbolicExpression {

    public enum Operator {
        PLUS("+"),
        NEGATE("-");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public UnaryOperation {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public SortedSet<String> freeSymbols() {
        return operand.freeSymbols();
    }

    @Override
    public String render() {
        return operator.symbol() + Precedence.wrap(operand, operand.precedence() <= Precedence.SIGN);
    }

    @Override
    public int precedence() {
        return Precedence.SIGN;
    }
}
