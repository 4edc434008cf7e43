package com.pgfga.reconciler.config;

import com.pgfga.reconciler.exception.ReconcilerException;
import com.pgfga.reconciler.model.StrictOptions;
import com.pgfga.reconciler.model.result.ReconciliationReport;
import com.pgfga.reconciler.model.spec.DesiredState;
import com.pgfga.reconciler.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs one reconciliation pass at startup and turns its outcome into the process exit code.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_PRUNE_FAILURES = 2;

    private final ReconciliationService reconciliationService;
    private final DesiredState desiredState;
    private final StrictOptions strictOptions;

    @Value("${pgfga.run-on-startup:true}")
    private boolean runOnStartup;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        if (!runOnStartup) {
            log.info("pgfga.run-on-startup is false, skipping reconciliation");
            return;
        }

        try {
            ReconciliationReport report = reconciliationService.reconcile(desiredState, strictOptions);
            if (report.isStandby()) {
                log.info("Nothing to do on a standby");
            } else if (report.hasFailures()) {
                exitCode = EXIT_PRUNE_FAILURES;
            }
        } catch (ReconcilerException | IllegalArgumentException e) {
            log.error("Reconciliation failed: {}", e.getMessage(), e);
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
