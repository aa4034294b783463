package ai.proofkit.extractor.structure;

import ai.proofkit.extractor.extract.ExpressionExtractor;
import ai.proofkit.extractor.extract.ExpressionRecord;
import ai.proofkit.extractor.extract.LogicalRoleClassifier;
import ai.proofkit.extractor.extract.ProofMethodTag;
import ai.proofkit.extractor.extract.RoleTag;
import ai.proofkit.extractor.extract.StatementClassification;
import ai.proofkit.extractor.extract.VariableExtractor;
import ai.proofkit.extractor.nlp.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the per-statement extractors and folds their output into a {@link ProofStructure}.
 */
public class StructureAggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(StructureAggregator.class);

    private final VariableExtractor variableExtractor;
    private final ExpressionExtractor expressionExtractor;
    private final LogicalRoleClassifier classifier;

    public StructureAggregator(VariableExtractor variableExtractor,
                               ExpressionExtractor expressionExtractor,
                               LogicalRoleClassifier classifier) {
        this.variableExtractor = Objects.requireNonNull(variableExtractor, "variableExtractor");
        this.expressionExtractor = Objects.requireNonNull(expressionExtractor, "expressionExtractor");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public ProofStructure aggregate(List<Statement> statements) {
        if (statements == null || statements.isEmpty()) {
            return ProofStructure.empty();
        }
        List<RoleTag> assumptions = new ArrayList<>();
        List<RoleTag> conclusions = new ArrayList<>();
        List<ProofMethodTag> methods = new ArrayList<>();
        List<Set<String>> variables = new ArrayList<>(statements.size());
        List<List<ExpressionRecord>> expressions = new ArrayList<>(statements.size());

        for (Statement statement : statements) {
            StatementClassification classification = classifier.classify(statement);
            assumptions.addAll(classification.assumptions());
            conclusions.addAll(classification.conclusions());
            methods.addAll(classification.proofMethods());

            Set<String> statementVariables = variableExtractor.extract(statement.tokens());
            List<ExpressionRecord> statementExpressions = expressionExtractor.extract(statement.text());
            variables.add(statementVariables);
            expressions.add(statementExpressions);

            LOGGER.debug("Statement {}: {} tags, variables={}, expressions={}",
                    statement.index(),
                    classification.assumptions().size() + classification.conclusions().size()
                            + classification.proofMethods().size(),
                    statementVariables, statementExpressions.size());
        }
        return new ProofStructure(assumptions, conclusions, methods, variables, expressions);
    }
}
