package ai.proofkit.extractor.cli;

import ai.proofkit.extractor.nlp.AnalyzerMode;
import picocli.CommandLine;

public class AnalyzerModeConverter implements CommandLine.ITypeConverter<AnalyzerMode> {

    @Override
    public AnalyzerMode convert(String value) {
        return AnalyzerMode.from(value);
    }
}
