package ai.proofkit.extractor.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Separates a theorem from its proof. An explicit "Proof" marker wins; otherwise a multi-line text is
 * split after its first line and a single line is taken to be the theorem alone.
 */
public class TheoremProofSplitter {

    private static final Pattern PROOF_MARKER = Pattern.compile("\\bProof[\\s:.]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    public TheoremProofSplit split(String text) {
        if (text == null || text.isBlank()) {
            return new TheoremProofSplit("", "");
        }
        Matcher marker = PROOF_MARKER.matcher(text);
        if (marker.find()) {
            return new TheoremProofSplit(text.substring(0, marker.start()).strip(), text.substring(marker.end()).strip());
        }

        String[] lines = LINE_BREAK.split(text.strip(), 2);
        if (lines.length < 2) {
            return new TheoremProofSplit(text.strip(), "");
        }
        return new TheoremProofSplit(lines[0].strip(), lines[1].strip());
    }
}
