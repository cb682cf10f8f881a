package com.saleslog.pipeline.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.saleslog.pipeline.driver.PipelineDriver;
import com.saleslog.pipeline.exception.DiscoveryException;
import com.saleslog.pipeline.factory.JsonFactory;
import com.saleslog.pipeline.model.BucketId;
import com.saleslog.pipeline.model.BucketResult;
import com.saleslog.pipeline.model.PipelineConfig;
import com.saleslog.pipeline.model.RunReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineRunnerTest {

    private final ObjectMapper objectMapper = new JsonFactory().reportObjectMapper();

    @TempDir
    Path dir;

    private static RunReport report(BucketResult... results) {
        return RunReport.from(Instant.EPOCH, Instant.EPOCH, List.of(results));
    }

    @Test
    @DisplayName("Successful run exits 0 and writes the JSON report when configured")
    void run_writesReport() throws Exception {
        PipelineDriver driver = mock(PipelineDriver.class);
        when(driver.run()).thenReturn(report(BucketResult.cancelled(new BucketId("2024112314"))));
        Path reportFile = dir.resolve("reports/run.json");
        PipelineConfig config = new PipelineConfig(dir.resolve("in"), dir.resolve("out"), 1, 1, null, reportFile);

        PipelineRunner runner = new PipelineRunner(driver, config, objectMapper, true);
        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(PipelineRunner.EXIT_OK);
        JsonNode json = objectMapper.readTree(Files.readString(reportFile));
        assertThat(json.get("buckets_cancelled").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Bucket failures exit 1")
    void run_bucketFailures() throws Exception {
        PipelineDriver driver = mock(PipelineDriver.class);
        when(driver.run()).thenReturn(report(BucketResult.failed(new BucketId("2024112314"), "boom")));

        PipelineRunner runner = new PipelineRunner(driver, PipelineConfig.of(dir, dir), objectMapper, true);
        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(PipelineRunner.EXIT_BUCKET_FAILURES);
        assertThat(runner.lastReport().bucketsFailed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Discovery failure exits 2")
    void run_discoveryFailure() throws Exception {
        PipelineDriver driver = mock(PipelineDriver.class);
        when(driver.run()).thenThrow(new DiscoveryException(dir, "gone", null));

        PipelineRunner runner = new PipelineRunner(driver, PipelineConfig.of(dir, dir), objectMapper, true);
        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(PipelineRunner.EXIT_DISCOVERY_FAILED);
        assertThat(runner.lastReport()).isNull();
    }

    @Test
    @DisplayName("Does nothing when run-on-startup is disabled")
    void run_disabled() throws Exception {
        PipelineDriver driver = mock(PipelineDriver.class);

        PipelineRunner runner = new PipelineRunner(driver, PipelineConfig.of(dir, dir), objectMapper, false);
        runner.run(new DefaultApplicationArguments());

        verify(driver, never()).run();
        assertThat(runner.getExitCode()).isEqualTo(PipelineRunner.EXIT_OK);
    }
}
