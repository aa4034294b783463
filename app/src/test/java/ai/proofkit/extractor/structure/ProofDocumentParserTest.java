package ai.proofkit.extractor.structure;

import static org.assertj.core.api.Assertions.assertThat;

import ai.proofkit.extractor.config.TargetProver;
import ai.proofkit.extractor.extract.ExpressionExtractor;
import ai.proofkit.extractor.extract.LogicalRoleClassifier;
import ai.proofkit.extractor.extract.VariableExtractor;
import ai.proofkit.extractor.hint.ProofPattern;
import ai.proofkit.extractor.nlp.RuleBasedProofTokenizer;
import org.junit.jupiter.api.Test;

class ProofDocumentParserTest {

    private final ProofDocumentParser documentParser = new ProofDocumentParser(new ProofParser(
            new RuleBasedProofTokenizer(),
            new StructureAggregator(new VariableExtractor(), new ExpressionExtractor(), new LogicalRoleClassifier())));

    @Test
    void splitsTheoremFromProofAndAnnotates() {
        String input = """
                Theorem. If n is odd then n^2 is odd.
                Proof. Suppose, for contradiction, that n^2 is even. Then n is even, which is absurd.
                """;

        ProofDocument document = documentParser.parse(input, TargetProver.COQ);

        assertThat(document.originalText()).isEqualTo(input);
        assertThat(document.theoremText()).isEqualTo("Theorem. If n is odd then n^2 is odd.");
        assertThat(document.proofText())
                .isEqualTo("Suppose, for contradiction, that n^2 is even. Then n is even, which is absurd.");
        assertThat(document.prover()).isEqualTo(TargetProver.COQ);
        assertThat(document.parseResult().statements()).hasSize(2);
        assertThat(document.pattern()).isEqualTo(ProofPattern.CONTRADICTION);
        assertThat(document.inductionVariable()).isEmpty();
        assertThat(document.domain().domainName()).isEqualTo("number_theory");
        assertThat(document.domain().involvesDiscrete()).isTrue();
    }

    @Test
    void theoremWithoutProofHasEmptyStructure() {
        ProofDocument document = documentParser.parse("Every prime above two is odd.", TargetProver.LEAN);

        assertThat(document.theoremText()).isEqualTo("Every prime above two is odd.");
        assertThat(document.proofText()).isEmpty();
        assertThat(document.structure().isEmpty()).isTrue();
        assertThat(document.pattern()).isEqualTo(ProofPattern.UNKNOWN);
        assertThat(document.domain().mscCode()).isEqualTo("11");
    }

    @Test
    void proofOnlyModeKeepsWholeInputAsProof() {
        ProofDocument document = documentParser.parseProofOnly(
                "Let x be a vector.\nThen x + 0 = x.", TargetProver.LEAN);

        assertThat(document.theoremText()).isEmpty();
        assertThat(document.proofText()).isEqualTo("Let x be a vector. Then x + 0 = x.");
        assertThat(document.parseResult().statements()).hasSize(2);
        assertThat(document.pattern()).isEqualTo(ProofPattern.DIRECT);
        assertThat(document.domain().domainName()).isEqualTo("algebra");
    }

    @Test
    void inductionProofCarriesInductionVariable() {
        ProofDocument document = documentParser.parse(
                "Theorem: For all m, m + m is even.\nProof: We use induction on m. In the base case m = 0.",
                TargetProver.COQ);

        assertThat(document.pattern()).isEqualTo(ProofPattern.INDUCTION);
        assertThat(document.inductionVariable()).contains("m");
    }

    @Test
    void inductionWithoutNamedVariableDefaultsToN() {
        ProofDocument document = documentParser.parseProofOnly("The claim follows by induction.", TargetProver.LEAN);

        assertThat(document.pattern()).isEqualTo(ProofPattern.INDUCTION);
        assertThat(document.inductionVariable()).contains("n");
    }
}
