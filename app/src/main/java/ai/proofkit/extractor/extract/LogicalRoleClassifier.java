package ai.proofkit.extractor.extract;

import ai.proofkit.extractor.nlp.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Tags statements with assumption/conclusion roles and proof-method hints by case-insensitive substring
 * matching against {@link KeywordTables}. Every matching entry contributes a tag: a statement may be
 * both assumption and conclusion, and repeated hints are not collapsed.
 */
public class LogicalRoleClassifier {

    private final KeywordTables tables;

    public LogicalRoleClassifier() {
        this(KeywordTables.defaults());
    }

    public LogicalRoleClassifier(KeywordTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables");
    }

    public StatementClassification classify(Statement statement) {
        Objects.requireNonNull(statement, "statement");
        String text = statement.text();
        String lowered = text.toLowerCase(Locale.ROOT);

        List<RoleTag> assumptions = new ArrayList<>();
        List<RoleTag> conclusions = new ArrayList<>();
        for (LogicalMarker marker : tables.logicalMarkers()) {
            if (!lowered.contains(marker.marker())) {
                continue;
            }
            RoleTag tag = new RoleTag(marker.role(), marker.marker(), marker.suggestedTactic(), statement.index(), text);
            switch (marker.role()) {
                case ASSUMPTION -> assumptions.add(tag);
                case CONCLUSION -> conclusions.add(tag);
            }
        }

        List<ProofMethodTag> methods = new ArrayList<>();
        for (MethodKeyword keyword : tables.methodKeywords()) {
            if (lowered.contains(keyword.keyword())) {
                methods.add(new ProofMethodTag(keyword.keyword(), keyword.method(), keyword.suggestedTactic(),
                        statement.index(), text));
            }
        }
        return new StatementClassification(assumptions, conclusions, methods);
    }
}
