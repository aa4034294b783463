package ai.proofkit.extractor.extract;

import ai.proofkit.extractor.expression.AlgebraicExpressionParser;
import ai.proofkit.extractor.expression.ExpressionParseException;
import ai.proofkit.extractor.expression.SymbolTable;
import ai.proofkit.extractor.expression.SymbolicExpression;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds algebraic expression substrings in statement text and parses them with a symbol table built from
 * the identifiers in each match. Failures never escape: they degrade to raw records.
 */
public class ExpressionExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExpressionExtractor.class);
    static final Pattern EXPRESSION_PATTERN =
            Pattern.compile("\\b([a-zA-Z][a-zA-Z0-9]*(?:\\s*+[+\\-*/^=]\\s*+[a-zA-Z0-9]++)++)");
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9]*");
    private static final String OPERATORS = "+-*/^=";
    static final int MAX_OPERATORS = 256;

    private final AlgebraicExpressionParser parser;

    public ExpressionExtractor() {
        this(new AlgebraicExpressionParser());
    }

    public ExpressionExtractor(AlgebraicExpressionParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public List<ExpressionRecord> extract(String statementText) {
        if (statementText == null || statementText.isBlank()) {
            return List.of();
        }
        List<ExpressionRecord> records = new ArrayList<>();
        Matcher matcher = EXPRESSION_PATTERN.matcher(statementText);
        while (matcher.find()) {
            records.add(parseCandidate(matcher.group(1)));
        }
        return List.copyOf(records);
    }

    /**
     * Parses one candidate expression, degrading to a raw record on any failure.
     */
    public ExpressionRecord parseCandidate(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return ExpressionRecord.raw(candidate == null ? "" : candidate);
        }
        int operators = operatorCount(candidate);
        if (operators > MAX_OPERATORS) {
            LOGGER.debug("Keeping raw expression with {} operators (limit {})", operators, MAX_OPERATORS);
            return ExpressionRecord.raw(candidate);
        }
        SymbolTable symbolTable = SymbolTable.of(identifiersIn(candidate));
        try {
            SymbolicExpression expression = parser.parse(candidate, symbolTable);
            return ExpressionRecord.parsed(candidate, expression);
        } catch (ExpressionParseException ex) {
            LOGGER.debug("Keeping raw expression '{}': {}", candidate, ex.getMessage());
            return ExpressionRecord.raw(candidate);
        } catch (RuntimeException ex) {
            LOGGER.debug("Unexpected failure parsing '{}', keeping raw text", candidate, ex);
            return ExpressionRecord.raw(candidate);
        }
    }

    private static int operatorCount(String candidate) {
        int count = 0;
        for (int i = 0; i < candidate.length(); i++) {
            if (OPERATORS.indexOf(candidate.charAt(i)) >= 0) {
                count++;
            }
        }
        return count;
    }

    static Set<String> identifiersIn(String candidate) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = IDENTIFIER_PATTERN.matcher(candidate);
        while (matcher.find()) {
            names.add(matcher.group());
        }
        return names;
    }
}
