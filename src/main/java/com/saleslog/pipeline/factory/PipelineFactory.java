package com.saleslog.pipeline.factory;

import com.saleslog.pipeline.model.PipelineConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Component
public class PipelineFactory {

    private final String inputRoot;
    private final String outputRoot;
    private final int bucketConcurrency;
    private final int fileConcurrency;
    private final long deadlineSeconds;
    private final String reportFile;

    public PipelineFactory(@Value("${pipeline.input-root:./logs}") String inputRoot,
                           @Value("${pipeline.output-root:./output}") String outputRoot,
                           @Value("${pipeline.bucket-concurrency:2}") int bucketConcurrency,
                           @Value("${pipeline.file-concurrency:4}") int fileConcurrency,
                           @Value("${pipeline.deadline-seconds:0}") long deadlineSeconds,
                           @Value("${pipeline.report-file:}") String reportFile) {
        this.inputRoot = inputRoot;
        this.outputRoot = outputRoot;
        this.bucketConcurrency = bucketConcurrency;
        this.fileConcurrency = fileConcurrency;
        this.deadlineSeconds = deadlineSeconds;
        this.reportFile = reportFile;
    }

    @Bean
    public PipelineConfig pipelineConfig() {
        if (deadlineSeconds < 0) {
            throw new IllegalArgumentException("pipeline.deadline-seconds must not be negative: " + deadlineSeconds);
        }
        Duration deadline = deadlineSeconds == 0 ? null : Duration.ofSeconds(deadlineSeconds);
        Path report = reportFile == null || reportFile.isBlank() ? null : Path.of(reportFile);
        return new PipelineConfig(Path.of(inputRoot), Path.of(outputRoot), bucketConcurrency, fileConcurrency,
                deadline, report);
    }

    @Bean
    public Clock pipelineClock() {
        return Clock.systemUTC();
    }
}
