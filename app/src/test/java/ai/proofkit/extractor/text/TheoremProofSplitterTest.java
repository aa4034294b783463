package ai.proofkit.extractor.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TheoremProofSplitterTest {

    private final TheoremProofSplitter splitter = new TheoremProofSplitter();

    @Test
    void splitsOnProofMarker() {
        TheoremProofSplit split = splitter.split("Theorem: n + n is even.\nProof: Let n be an integer.");

        assertThat(split.theorem()).isEqualTo("Theorem: n + n is even.");
        assertThat(split.proof()).isEqualTo("Let n be an integer.");
        assertThat(split.hasProof()).isTrue();
    }

    @Test
    void markerMatchingIgnoresCaseAndLineBreaks() {
        TheoremProofSplit split = splitter.split("Every square is non-negative. PROOF.\n\nConsider x*x.");

        assertThat(split.theorem()).isEqualTo("Every square is non-negative.");
        assertThat(split.proof()).isEqualTo("Consider x*x.");
    }

    @Test
    void fallsBackToFirstLineWithoutMarker() {
        TheoremProofSplit split = splitter.split("  There are infinitely many primes.\nSuppose not.\nThen ...  ");

        assertThat(split.theorem()).isEqualTo("There are infinitely many primes.");
        assertThat(split.proof()).isEqualTo("Suppose not.\nThen ...");
    }

    @Test
    void singleLineIsTheoremOnly() {
        TheoremProofSplit split = splitter.split("Every even number squared is even.");

        assertThat(split.theorem()).isEqualTo("Every even number squared is even.");
        assertThat(split.hasProof()).isFalse();
    }

    @Test
    void wordsMerelyContainingMarkerAreNotSplit() {
        TheoremProofSplit split = splitter.split("Waterproof claims hold.");

        assertThat(split.theorem()).isEqualTo("Waterproof claims hold.");
        assertThat(split.proof()).isEmpty();
    }

    @Test
    void blankInputYieldsEmptySplit() {
        assertThat(splitter.split(null)).isEqualTo(new TheoremProofSplit("", ""));
        assertThat(splitter.split("  ")).isEqualTo(new TheoremProofSplit("", ""));
    }
}
