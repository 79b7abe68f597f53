package com.example.footprint.cli;

import com.example.footprint.dto.JobStatusResponse;
import com.example.footprint.model.CalculationMethod;
import com.example.footprint.model.FootprintResult;
import com.example.footprint.model.GasContribution;
import com.example.footprint.model.JobStatus;
import com.example.footprint.model.ProductInputs;
import com.example.footprint.service.FootprintJobService;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CommandLineRunnerTest {

    private static final String REQUEST = """
            {
              "subjectRef": "product-1",
              "inputs": {
                "productCategory": "cider",
                "materials": [
                  {"name": "bottle", "category": "glass", "massKg": 0.5},
                  {"name": "apples", "category": "apples", "massKg": 2.0}
                ],
                "productionParameters": {"energy_kwh": 1.2}
              },
              "options": {"method": "HYBRID"}
            }
            """;

    @TempDir
    Path tempDir;

    private FootprintJobService jobService;
    private CommandLineRunner runner;
    private ByteArrayOutputStream output;
    private Path inputsFile;

    @BeforeEach
    void setUp() throws IOException {
        jobService = mock(FootprintJobService.class);
        runner = new CommandLineRunner(jobService, JsonMapper.builder().findAndAddModules().build());
        output = new ByteArrayOutputStream();
        inputsFile = tempDir.resolve("request.json");
        Files.writeString(inputsFile, REQUEST);
    }

    @Test
    void shouldSubmitPollAndPrintFootprint() throws IOException {
        // Given
        when(jobService.submit(anyString(), any(), any())).thenReturn("job-1");
        when(jobService.getStatus("job-1")).thenReturn(
                status(JobStatus.PROCESSING, 30, null),
                status(JobStatus.COMPLETED, 100, FootprintResult.builder()
                        .totalCo2e(37.9)
                        .ghgEntry(GasContribution.builder().gasName("CH4").massKg(1).gwpFactor(27.9).co2e(27.9).build())
                        .build()));

        // When
        int exitCode = runner.execute(inputsFile, Duration.ofSeconds(5), Duration.ofMillis(1), out());

        // Then
        assertEquals(0, exitCode);
        ArgumentCaptor<ProductInputs> inputs = ArgumentCaptor.forClass(ProductInputs.class);
        verify(jobService).submit(eq("product-1"), inputs.capture(), argThat(o -> o.getMethod() == CalculationMethod.HYBRID));
        assertEquals(2, inputs.getValue().getMaterials().size());
        assertEquals(1.2, inputs.getValue().getProductionParameters().get("energy_kwh").doubleValue(), 0.0);

        String printed = printed();
        assertTrue(printed.contains("Job submitted: job-1"));
        assertTrue(printed.contains("Total CO2e (kg):      37.9"));
        assertTrue(printed.contains("CH4"));
    }

    @Test
    void shouldExitWithErrorForFailedJob() throws IOException {
        when(jobService.submit(anyString(), any(), any())).thenReturn("job-1");
        JobStatusResponse failed = status(JobStatus.FAILED, 30, null);
        failed.setErrorMessage("Engine data error: missing process");
        when(jobService.getStatus("job-1")).thenReturn(failed);

        int exitCode = runner.execute(inputsFile, Duration.ofSeconds(5), Duration.ofMillis(1), out());

        assertEquals(1, exitCode);
        assertTrue(printed().contains("Engine data error: missing process"));
    }

    @Test
    void shouldCancelJobOnTimeout() throws IOException {
        when(jobService.submit(anyString(), any(), any())).thenReturn("job-1");
        when(jobService.getStatus("job-1")).thenReturn(status(JobStatus.PENDING, 0, null));

        int exitCode = runner.execute(inputsFile, Duration.ofMillis(50), Duration.ofMillis(5), out());

        assertEquals(1, exitCode);
        verify(jobService).cancel("job-1");
    }

    private PrintStream out() {
        return new PrintStream(output, true, StandardCharsets.UTF_8);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private static JobStatusResponse status(JobStatus status, int progress, FootprintResult result) {
        return JobStatusResponse.builder()
                .jobId("job-1")
                .status(status)
                .progress(progress)
                .currentStep("step")
                .result(result)
                .build();
    }
}
