package ai.proofkit.extractor.cli;

import ai.proofkit.extractor.extract.ExpressionRecord;
import ai.proofkit.extractor.extract.ProofMethodTag;
import ai.proofkit.extractor.extract.RoleTag;
import ai.proofkit.extractor.hint.DomainClassification;
import ai.proofkit.extractor.hint.ProofPattern;
import ai.proofkit.extractor.nlp.Statement;
import ai.proofkit.extractor.nlp.Token;
import ai.proofkit.extractor.structure.ProofDocument;
import ai.proofkit.extractor.structure.ProofStructure;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Renders a {@link ProofDocument} as the JSON handed to the translator stage.
 */
public class ProofJsonWriter {

    private final ObjectMapper objectMapper;

    public ProofJsonWriter() {
        this(new ObjectMapper());
    }

    ProofJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(ProofDocument document, boolean pretty) {
        ObjectNode root = toJson(document);
        try {
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root)
                    : objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize proof document", ex);
        }
    }

    ObjectNode toJson(ProofDocument document) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("prover", document.prover().id());
        root.put("theorem_text", document.theoremText());
        root.put("proof_text", document.proofText());
        root.put("original_text", document.originalText());
        root.set("parsed_statements", statements(document.parseResult().statements()));
        root.set("proof_structure", structure(document.structure()));
        root.set("pattern", pattern(document.pattern(), document.inductionVariable()));
        root.set("domain", domain(document.domain()));
        return root;
    }

    private ArrayNode statements(List<Statement> statements) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Statement statement : statements) {
            ObjectNode node = array.addObject();
            node.put("index", statement.index());
            node.put("text", statement.text());
            ArrayNode tokens = node.putArray("tokens");
            for (Token token : statement.tokens()) {
                ObjectNode tokenNode = tokens.addObject();
                tokenNode.put("text", token.text());
                tokenNode.put("category", token.category().name());
                tokenNode.put("relation", token.relation());
            }
        }
        return array;
    }

    private ObjectNode structure(ProofStructure structure) {
        ObjectNode node = objectMapper.createObjectNode();
        node.set("assumptions", roleTags(structure.assumptions()));
        node.set("conclusions", roleTags(structure.conclusions()));

        ArrayNode methods = node.putArray("proof_methods");
        for (ProofMethodTag tag : structure.proofMethods()) {
            ObjectNode methodNode = methods.addObject();
            methodNode.put("keyword", tag.keyword());
            methodNode.put("method", tag.method().canonicalName());
            putOptional(methodNode, "tactic", tag.suggestedTactic());
            methodNode.put("statement", tag.statementIndex());
        }

        ArrayNode variables = node.putArray("variables");
        for (Set<String> names : structure.variables()) {
            ArrayNode namesNode = variables.addArray();
            names.forEach(namesNode::add);
        }

        ArrayNode expressions = node.putArray("expressions");
        for (List<ExpressionRecord> records : structure.expressions()) {
            ArrayNode recordsNode = expressions.addArray();
            for (ExpressionRecord record : records) {
                ObjectNode recordNode = recordsNode.addObject();
                recordNode.put("source", record.source());
                recordNode.put("parsed", record.isParsed());
                recordNode.put("form", record.form());
                ArrayNode recordVariables = recordNode.putArray("variables");
                record.variables().forEach(recordVariables::add);
            }
        }
        return node;
    }

    private ArrayNode roleTags(List<RoleTag> tags) {
        ArrayNode array = objectMapper.createArrayNode();
        for (RoleTag tag : tags) {
            ObjectNode node = array.addObject();
            node.put("marker", tag.marker());
            putOptional(node, "tactic", tag.suggestedTactic());
            node.put("statement", tag.statementIndex());
            node.put("text", tag.statementText());
        }
        return array;
    }

    private ObjectNode pattern(ProofPattern pattern, Optional<String> inductionVariable) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", pattern.name());
        node.put("confidence", pattern.confidence());
        node.put("description", pattern.description());
        putOptional(node, "induction_variable", inductionVariable);
        return node;
    }

    private ObjectNode domain(DomainClassification domain) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("primary_domain", domain.mscCode());
        node.put("domain_name", domain.domainName());
        node.put("confidence", domain.confidence());
        node.put("involves_discrete", domain.involvesDiscrete());
        node.put("is_evenness_proof", domain.evennessProof());
        ObjectNode scores = node.putObject("domain_scores");
        for (Map.Entry<String, Integer> entry : domain.scores().entrySet()) {
            scores.put(entry.getKey(), entry.getValue());
        }
        return node;
    }

    private void putOptional(ObjectNode node, String field, Optional<String> value) {
        if (value.isPresent()) {
            node.put(field, value.get());
        } else {
            node.putNull(field);
        }
    }
}
