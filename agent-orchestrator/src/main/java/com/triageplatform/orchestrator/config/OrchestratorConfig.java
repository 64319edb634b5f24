package com.triageplatform.orchestrator.config;

import com.triageplatform.analysis.extraction.DeterministicSignalExtractor;
import com.triageplatform.analysis.service.ParallelExecutor;
import com.triageplatform.common.aggregation.HypothesisAggregator;
import com.triageplatform.common.extraction.SignalExtractor;
import com.triageplatform.common.registry.WorkerRegistry;
import com.triageplatform.common.synthesis.NarrativeSynthesizer;
import com.triageplatform.common.validation.ResultValidator;
import com.triageplatform.common.worker.AnalysisWorker;
import com.triageplatform.orchestrator.logger.PipelineFlowLogger;
import com.triageplatform.orchestrator.pipeline.PipelineOrchestrator;
import com.triageplatform.orchestrator.worker.SignalScopedWorker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class OrchestratorConfig {

    @Value("${pipeline.worker-timeout:30s}")
    private Duration workerTimeout;

    /** Registers every {@link AnalysisWorker} bean; two beans with the same worker name fail start-up. */
    @Bean
    public WorkerRegistry workerRegistry(ObjectProvider<AnalysisWorker> workers) {
        WorkerRegistry registry = new WorkerRegistry();
        workers.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    public ParallelExecutor parallelExecutor() {
        return new ParallelExecutor(workerTimeout);
    }

    @Bean
    public ResultValidator resultValidator() {
        return new ResultValidator();
    }

    @Bean
    public HypothesisAggregator hypothesisAggregator() {
        return new HypothesisAggregator();
    }

    @Bean
    public SignalExtractor signalExtractor() {
        return new DeterministicSignalExtractor();
    }

    @Bean
    public PipelineFlowLogger pipelineFlowLogger() {
        return new PipelineFlowLogger();
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(WorkerRegistry registry,
                                                     SignalExtractor extractor,
                                                     ParallelExecutor executor,
                                                     ResultValidator validator,
                                                     HypothesisAggregator aggregator,
                                                     ObjectProvider<NarrativeSynthesizer> synthesizer,
                                                     PipelineFlowLogger flowLogger) {
        return new PipelineOrchestrator(registry, extractor, executor, validator, aggregator,
            synthesizer.getIfAvailable(), flowLogger);
    }

    /** Built-in rule-based workers, one per analyzer source. */
    @Configuration
    @ConditionalOnProperty(name = "pipeline.builtin-workers.enabled", havingValue = "true", matchIfMissing = true)
    static class BuiltinWorkers {

        @Bean
        public AnalysisWorker logWorker() {
            return new SignalScopedWorker("log_agent", "Error Rate Spike",
                "Error rate elevated above baseline", 0.82, "log");
        }

        @Bean
        public AnalysisWorker metricsWorker() {
            return new SignalScopedWorker("metrics_agent", "DB Connection Pool Exhaustion",
                "Connection pool near capacity", 0.91, "metrics");
        }

        @Bean
        public AnalysisWorker commitWorker() {
            return new SignalScopedWorker("commit_agent", "Cache Removal Impact",
                "Recent commit removed cache layer", 0.78, "commit");
        }

        @Bean
        public AnalysisWorker configWorker() {
            return new SignalScopedWorker("config_agent", "Connection Pool Undersized",
                "Pool size insufficient for traffic", 0.65, "config");
        }
    }
}
