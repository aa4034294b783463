package ai.proofkit.extractor.cli;

import ai.proofkit.extractor.config.TargetProver;
import picocli.CommandLine;

public class TargetProverConverter implements CommandLine.ITypeConverter<TargetProver> {

    @Override
    public TargetProver convert(String value) {
        return TargetProver.from(value);
    }
}
