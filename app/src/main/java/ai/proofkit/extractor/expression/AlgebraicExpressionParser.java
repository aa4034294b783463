package ai.proofkit.extractor.expression;

import java.util.Objects;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Parses algebraic expressions ({@code + - * / ^ =}, parentheses, unary sign) into {@link SymbolicExpression}
 * trees. Identifiers are bound through an explicit {@link SymbolTable}; the input is never evaluated.
 * Instances are stateless and safe to share.
 */
public class AlgebraicExpressionParser {

    /**
     * @throws ExpressionParseException on lexical or syntax errors and on identifiers missing from
     *                                  {@code symbolTable}
     */
    public SymbolicExpression parse(String expression, SymbolTable symbolTable) {
        Objects.requireNonNull(symbolTable, "symbolTable");
        if (expression == null || expression.isBlank()) {
            throw new ExpressionParseException(expression, "Expression must not be blank");
        }

        ThrowingErrorListener errorListener = new ThrowingErrorListener(expression);
        AlgebraLexer lexer = new AlgebraLexer(CharStreams.fromString(expression));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        AlgebraParser parser = new AlgebraParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);
        parser.setErrorHandler(new BailErrorStrategy());

        AlgebraParser.RelationContext tree;
        try {
            tree = parser.relation();
        } catch (ParseCancellationException ex) {
            throw new ExpressionParseException(expression, "Malformed expression: " + expression, ex);
        }
        return new SymbolicExpressionBuilder(expression, symbolTable).visit(tree);
    }

    private static final class ThrowingErrorListener extends BaseErrorListener {

        private final String source;

        private ThrowingErrorListener(String source) {
            this.source = source;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new ExpressionParseException(source,
                    "Malformed expression at column " + charPositionInLine + ": " + msg, e);
        }
    }
}
