package ai.proofkit.extractor.extract;

import ai.proofkit.extractor.expression.SymbolicExpression;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An expression found in a statement: either parsed, with its free variables, or kept as the raw
 * matched text with no variables when parsing failed.
 */
public record ExpressionRecord(String source, Optional<SymbolicExpression> symbolic, List<String> variables) {

    public ExpressionRecord {
        Objects.requireNonNull(source, "source");
        symbolic = symbolic == null ? Optional.empty() : symbolic;
        variables = variables == null ? List.of() : List.copyOf(variables);
    }

    public static ExpressionRecord parsed(String source, SymbolicExpression expression) {
        Objects.requireNonNull(expression, "expression");
        return new ExpressionRecord(source, Optional.of(expression), List.copyOf(expression.freeSymbols()));
    }

    public static ExpressionRecord raw(String source) {
        return new ExpressionRecord(source, Optional.empty(), List.of());
    }

    public boolean isParsed() {
        return symbolic.isPresent();
    }

    /**
     * Canonical rendering when parsed, otherwise the raw source.
     */
    public String form() {
        return symbolic.map(SymbolicExpression::render).orElse(source);
    }
}
