package org.argverify.config;

import org.argverify.Config;
import org.argverify.io.ArtifactJsonReader;
import org.argverify.logic.CachingSolverBackend;
import org.argverify.logic.SolverBackend;
import org.argverify.logic.Z3SolverBackend;
import org.argverify.pipeline.PipelineFactory;
import org.argverify.request.VerifierSettings;
import org.argverify.service.VerificationService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.*;

@Configuration
public class AppConfig {

    @Value("${app.solver.timeout-ms:10000}")
    private long solverTimeoutMs;

    @Bean
    public VerifierSettings verifierSettings() {
        return new VerifierSettings(Config.FROM_KEY, Config.FORMALIZATION_KEY, Config.DECLARATIONS_KEY, solverTimeoutMs);
    }

    @Bean
    public SolverBackend solverBackend() {
        return new CachingSolverBackend(new Z3SolverBackend(), Config.SOLVER_CACHE_SIZE);
    }

    @Bean
    public PipelineFactory pipelineFactory(VerifierSettings settings, SolverBackend backend) {
        return new PipelineFactory(settings, backend);
    }

    @Bean
    public VerificationService verificationService(PipelineFactory pipelines) {
        return new VerificationService(pipelines);
    }

    @Bean
    public ArtifactJsonReader artifactJsonReader() {
        return new ArtifactJsonReader();
    }
}
