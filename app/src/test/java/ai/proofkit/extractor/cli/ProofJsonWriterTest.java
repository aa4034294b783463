package ai.proofkit.extractor.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.proofkit.extractor.config.TargetProver;
import ai.proofkit.extractor.extract.ExpressionExtractor;
import ai.proofkit.extractor.extract.LogicalRoleClassifier;
import ai.proofkit.extractor.extract.VariableExtractor;
import ai.proofkit.extractor.nlp.RuleBasedProofTokenizer;
import ai.proofkit.extractor.structure.ProofDocument;
import ai.proofkit.extractor.structure.ProofDocumentParser;
import ai.proofkit.extractor.structure.ProofParser;
import ai.proofkit.extractor.structure.StructureAggregator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

class ProofJsonWriterTest {

    private final ProofDocumentParser documentParser = new ProofDocumentParser(new ProofParser(
            new RuleBasedProofTokenizer(),
            new StructureAggregator(new VariableExtractor(), new ExpressionExtractor(), new LogicalRoleClassifier())));

    private final ProofJsonWriter writer = new ProofJsonWriter();

    @Test
    void serializesStatementsAndStructure() {
        ProofDocument document = documentParser.parseProofOnly("Since x = 1, we have x + 2 = 3. So y + + = 0 fails.",
                TargetProver.COQ);

        ObjectNode json = writer.toJson(document);

        assertThat(json.get("prover").asText()).isEqualTo("coq");
        JsonNode firstToken = json.get("parsed_statements").get(0).get("tokens").get(0);
        assertThat(firstToken.get("text").asText()).isEqualTo("Since");
        assertThat(firstToken.get("category").asText()).isEqualTo("SCONJ");
        assertThat(firstToken.get("relation").asText()).isEqualTo("dep");

        JsonNode conclusions = json.get("proof_structure").get("conclusions");
        assertThat(conclusions).hasSize(2);
        assertThat(conclusions.get(0).get("marker").asText()).isEqualTo("since");
        assertThat(conclusions.get(0).get("tactic").isNull()).isTrue();
        assertThat(conclusions.get(1).get("marker").asText()).isEqualTo("we have");
        assertThat(conclusions.get(1).get("tactic").asText()).isEqualTo("assert");

        JsonNode expressions = json.get("proof_structure").get("expressions").get(0);
        assertThat(expressions).hasSize(2);
        assertThat(expressions.get(1).get("form").asText()).isEqualTo("x + 2 = 3");
        assertThat(expressions.get(1).get("parsed").asBoolean()).isTrue();
        assertThat(expressions.get(1).get("variables").get(0).asText()).isEqualTo("x");
        assertThat(json.get("proof_structure").get("variables").get(1).get(0).asText()).isEqualTo("y");
    }

    @Test
    void serializesHints() {
        ProofDocument document = documentParser.parse("Theorem: n + n is even.\nProof: Assume n is even.",
                TargetProver.LEAN);

        ObjectNode json = writer.toJson(document);

        assertThat(json.get("pattern").get("name").asText()).isEqualTo("evenness_proof");
        assertThat(json.get("pattern").get("confidence").asDouble()).isEqualTo(0.8);
        assertThat(json.get("pattern").get("induction_variable").isNull()).isTrue();
        assertThat(json.get("domain").get("primary_domain").asText()).isEqualTo("11");
        assertThat(json.get("domain").get("is_evenness_proof").asBoolean()).isTrue();
        assertThat(json.get("domain").get("domain_scores").get("number_theory").asInt()).isEqualTo(2);
    }

    @Test
    void serializesInductionVariable() {
        ProofDocument document = documentParser.parseProofOnly("We proceed by induction on k. Hence k + 1 = 1 + k.",
                TargetProver.COQ);

        ObjectNode json = writer.toJson(document);

        assertThat(json.get("pattern").get("name").asText()).isEqualTo("induction");
        assertThat(json.get("pattern").get("induction_variable").asText()).isEqualTo("k");
    }

    @Test
    void prettyOutputSpansLines() {
        ProofDocument document = documentParser.parseProofOnly("Let x be real.", TargetProver.COQ);

        assertThat(writer.write(document, false)).doesNotContain("\n");
        assertThat(writer.write(document, true)).contains("\n").contains("\"proof_structure\"");
    }
}
