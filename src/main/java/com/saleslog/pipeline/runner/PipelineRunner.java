package com.saleslog.pipeline.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.saleslog.pipeline.driver.PipelineDriver;
import com.saleslog.pipeline.exception.DiscoveryException;
import com.saleslog.pipeline.model.BucketResult;
import com.saleslog.pipeline.model.PipelineConfig;
import com.saleslog.pipeline.model.RunReport;
import com.saleslog.pipeline.utils.SummaryFileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs the pipeline once when the application starts and turns the outcome into an exit code.
 */
@Component
public class PipelineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_BUCKET_FAILURES = 1;
    static final int EXIT_DISCOVERY_FAILED = 2;

    private final PipelineDriver driver;
    private final PipelineConfig config;
    private final ObjectMapper objectMapper;
    private final boolean runOnStartup;

    private volatile int exitCode = EXIT_OK;
    private volatile RunReport lastReport;

    public PipelineRunner(PipelineDriver driver,
                          PipelineConfig config,
                          @Qualifier("reportObjectMapper") ObjectMapper objectMapper,
                          @Value("${pipeline.run-on-startup:true}") boolean runOnStartup) {
        this.driver = driver;
        this.config = config;
        this.objectMapper = objectMapper;
        this.runOnStartup = runOnStartup;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!runOnStartup) {
            log.info("pipeline.run-on-startup is false, not running");
            return;
        }
        runOnce();
    }

    public RunReport runOnce() {
        RunReport report;
        try {
            report = driver.run();
        } catch (DiscoveryException e) {
            exitCode = EXIT_DISCOVERY_FAILED;
            return null;
        }
        lastReport = report;
        for (BucketResult failure : report.failures()) {
            log.error("Bucket {} failed: {}", failure.bucketId(), failure.error());
        }
        config.runReportFile().ifPresent(path -> writeReport(path, report));
        exitCode = report.hasFailures() ? EXIT_BUCKET_FAILURES : EXIT_OK;
        return report;
    }

    private void writeReport(Path path, RunReport report) {
        try {
            SummaryFileUtils.replaceFile(path, objectMapper.writeValueAsString(report));
            log.info("Run report written to {}", path);
        } catch (IOException e) {
            log.error("Failed to write run report to {}", path, e);
        }
    }

    public RunReport lastReport() {
        return lastReport;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
