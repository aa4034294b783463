package ai.proofkit.extractor.hint;

import java.util.List;

/**
 * Mathematical domains recognised by keyword, with their Mathematics Subject Classification codes.
 */
public enum MathDomain {
    NUMBER_THEORY("number_theory", "11",
            List.of("prime", "divisible", "gcd", "modulo", "congruence", "integer", "factor", "even", "odd")),
    ALGEBRA("algebra", "12-20",
            List.of("group", "ring", "field", "vector", "space", "linear", "matrix", "determinant")),
    TOPOLOGY("topology", "54-55",
            List.of("open", "closed", "continuous", "compact", "connected", "neighborhood", "metric")),
    ANALYSIS("analysis", "26-42",
            List.of("limit", "derivative", "integral", "convergence", "sequence", "series", "function")),
    GEOMETRY("geometry", "51-53",
            List.of("triangle", "circle", "angle", "polygon", "distance", "line", "plane")),
    SET_THEORY("set_theory", "03",
            List.of("set", "subset", "union", "intersection", "complement", "element", "belongs"));

    public static final String GENERAL_NAME = "general_mathematics";
    public static final String GENERAL_MSC_CODE = "00";

    private final String domainName;
    private final String mscCode;
    private final List<String> keywords;

    MathDomain(String domainName, String mscCode, List<String> keywords) {
        this.domainName = domainName;
        this.mscCode = mscCode;
        this.keywords = keywords;
    }

    public String domainName() {
        return domainName;
    }

    public String mscCode() {
        return mscCode;
    }

    public List<String> keywords() {
        return keywords;
    }
}
