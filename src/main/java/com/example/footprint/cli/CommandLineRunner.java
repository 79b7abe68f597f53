package com.example.footprint.cli;

import com.example.footprint.dto.CalculationRequest;
import com.example.footprint.dto.JobStatusResponse;
import com.example.footprint.model.FootprintResult;
import com.example.footprint.service.FootprintJobService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * CLI интерфейс для разового расчёта из командной строки.
 *
 * Примеры использования:
 *
 * java -jar footprint-jobs.jar --inputs=./request.json
 *
 * java -jar footprint-jobs.jar --inputs=./request.json --timeout=PT10M --poll-interval=PT1S
 *
 * Без параметра --inputs приложение работает как долгоживущий сервис воркеров.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandLineRunner implements ApplicationRunner {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);
    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

    private final FootprintJobService jobService;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (!args.containsOption("inputs")) {
            log.info("Starting in worker service mode. Use --inputs=<file.json> for CLI mode.");
            return;
        }

        log.info("Starting in CLI mode");

        int exitCode;
        try {
            exitCode = execute(
                    Path.of(getRequiredOption(args, "inputs")),
                    Duration.parse(getOption(args, "timeout", DEFAULT_TIMEOUT.toString())),
                    Duration.parse(getOption(args, "poll-interval", DEFAULT_POLL_INTERVAL.toString())),
                    System.out);
        } catch (Exception e) {
            log.error("CLI execution failed: {}", e.getMessage(), e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    /**
     * Ставит задачу из файла и опрашивает её статус до терминального.
     *
     * @return код завершения: 0 для COMPLETED, 1 в остальных случаях
     */
    int execute(Path inputsFile, Duration timeout, Duration pollInterval, PrintStream out) throws IOException {
        CalculationRequest request = objectMapper.readValue(Files.readString(inputsFile), CalculationRequest.class);

        printBanner(out);
        out.println("Subject: " + request.getSubjectRef());
        out.println("Inputs:  " + inputsFile.toAbsolutePath());
        out.println();

        String jobId = jobService.submit(request.getSubjectRef(), request.getInputs(), request.getOptions());
        out.println("Job submitted: " + jobId);

        long deadline = System.nanoTime() + timeout.toNanos();
        int lastProgress = -1;
        JobStatusResponse status = jobService.getStatus(jobId);
        while (!status.getStatus().isTerminal()) {
            if (status.getProgress() != lastProgress) {
                lastProgress = status.getProgress();
                out.println("  [" + lastProgress + "%] " + status.getCurrentStep());
            }
            if (System.nanoTime() > deadline) {
                out.println("Timed out after " + timeout + " waiting for job " + jobId);
                jobService.cancel(jobId);
                return 1;
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                out.println("Interrupted while waiting for job " + jobId);
                return 1;
            }
            status = jobService.getStatus(jobId);
        }

        printSummary(status, out);
        return status.getResult() != null ? 0 : 1;
    }

    private void printBanner(PrintStream out) {
        out.println();
        out.println("╔═══════════════════════════════════════════════════════════╗");
        out.println("║              Footprint Jobs - LCA Calculation             ║");
        out.println("╚═══════════════════════════════════════════════════════════╝");
        out.println();
    }

    private void printSummary(JobStatusResponse status, PrintStream out) {
        out.println();
        out.println("═══════════════════════════════════════════════════════════");
        out.println("                     FOOTPRINT SUMMARY                      ");
        out.println("═══════════════════════════════════════════════════════════");
        out.println();
        out.println("  Job:                  " + status.getJobId());
        out.println("  Status:               " + status.getStatus());
        out.println("  Attempts:             " + status.getAttempt());

        FootprintResult result = status.getResult();
        if (result != null) {
            out.println("  Total CO2e (kg):      " + result.getTotalCo2e());
            out.println("  Water (L):            " + result.getWaterFootprintLiters());
            out.println("  Degraded:             " + (result.isDegraded() ? "YES (category estimate)" : "no"));
            if (result.getMetadata() != null) {
                out.println("  Method:               " + result.getMetadata().getCalculationMethod());
                out.println("  Factor version:       " + result.getMetadata().getFactorVersion());
            }
            if (!result.getGhgBreakdown().isEmpty()) {
                out.println();
                out.println("  Breakdown by gas:");
                result.getGhgBreakdown().forEach(gas -> out.println(
                        "    - " + gas.getGasName() + ": " + gas.getMassKg() + " kg x " + gas.getGwpFactor()
                                + " = " + gas.getCo2e() + " kg CO2e"));
            }
        } else if (status.getErrorMessage() != null) {
            out.println("  Error:                " + status.getErrorMessage());
        }

        out.println();
        out.println("═══════════════════════════════════════════════════════════");
        out.println();
    }

    private String getRequiredOption(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            throw new IllegalArgumentException("Required option --" + name + " is missing");
        }
        return args.getOptionValues(name).get(0);
    }

    private String getOption(ApplicationArguments args, String name, String defaultValue) {
        if (args.containsOption(name)) {
            return args.getOptionValues(name).get(0);
        }
        return defaultValue;
    }
}
