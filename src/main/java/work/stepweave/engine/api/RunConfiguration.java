package work.stepweave.engine.api;

import java.nio.file.Path;
import java.util.Objects;
import work.stepweave.engine.config.EngineConfiguration;

/**
 * Immutable description of one workflow run requested through {@link WorkflowRunner}.
 */
public record RunConfiguration(
    Path workflowFile,
    String inputPayload,
    EngineConfiguration engineConfiguration
) {
    public RunConfiguration {
        Objects.requireNonNull(workflowFile, "workflowFile");
        Objects.requireNonNull(inputPayload, "inputPayload");
        Objects.requireNonNull(engineConfiguration, "engineConfiguration");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path workflowFile;
        private String inputPayload = "{}";
        private EngineConfiguration engineConfiguration = EngineConfiguration.defaults();

        public Builder workflowFile(Path workflowFile) {
            this.workflowFile = workflowFile;
            return this;
        }

        public Builder inputPayload(String inputPayload) {
            this.inputPayload = inputPayload;
            return this;
        }

        public Builder engineConfiguration(EngineConfiguration engineConfiguration) {
            this.engineConfiguration = engineConfiguration;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(workflowFile, inputPayload, engineConfiguration);
        }
    }
}
