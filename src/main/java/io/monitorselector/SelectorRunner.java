package io.monitorselector;

import io.monitorselector.models.ProcessResult;
import io.monitorselector.models.StatusChange;
import io.monitorselector.store.ServerNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.dao.DataAccessException;

import java.io.PrintStream;

import static io.monitorselector.config.Constants.*;

/**
 * Executes the command given on the command line once the context is ready.
 * {@code server} starts the review loop; {@code once} and {@code simulate} run to completion
 * and leave their exit code for {@code SpringApplication.exit}.
 */
@Slf4j
public class SelectorRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    private final SelectorCommandLine commandLine;
    private final MonitorSelector selector;
    private final PrintStream out;

    private volatile int exitCode = EXIT_OK;

    public SelectorRunner(SelectorCommandLine commandLine, MonitorSelector selector, PrintStream out) {
        this.commandLine = commandLine;
        this.selector = selector;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        switch (commandLine.getCommand()) {
            case COMMAND_SERVER:
                selector.start();
                break;
            case COMMAND_ONCE:
                exitCode = runOnce();
                break;
            case COMMAND_SIMULATE:
                exitCode = runSimulate();
                break;
            default:
                throw new IllegalStateException("Unknown command: " + commandLine.getCommand());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int runOnce() {
        try {
            if (commandLine.getServerId() != null) {
                ProcessResult result = selector.processServer(commandLine.getServerId());
                log.info("Single server run complete: {}", result);
                return EXIT_OK;
            }
            int processed = selector.runPass();
            log.info("Single pass complete: {} servers processed, {} failed", processed, selector.getServersFailed());
            return EXIT_OK;
        } catch (ServerNotFoundException e) {
            log.error("{}", e.getMessage());
            return EXIT_FAILED;
        } catch (DataAccessException e) {
            log.error("Single pass failed: {}", e.getMessage(), e);
            return EXIT_FAILED;
        }
    }

    private int runSimulate() {
        long serverId = commandLine.getServerId();
        try {
            ProcessResult result = selector.simulate(serverId);
            printSimulation(result);
            return EXIT_OK;
        } catch (ServerNotFoundException e) {
            log.error("{}", e.getMessage());
            return EXIT_FAILED;
        } catch (DataAccessException e) {
            log.error("Simulation for server {} failed: {}", serverId, e.getMessage(), e);
            return EXIT_FAILED;
        }
    }

    void printSimulation(ProcessResult result) {
        if (result.getPlannedChanges().isEmpty()) {
            out.printf("server %d: %d monitors evaluated, no changes would be applied%n",
                    result.getServerId(), result.getEvaluatedMonitors());
            return;
        }
        out.printf("server %d: %d monitors evaluated, %d changes would be applied%n",
                result.getServerId(), result.getEvaluatedMonitors(), result.getPlannedChanges().size());
        for (StatusChange change : result.getPlannedChanges()) {
            out.printf("  monitor %d: %s -> %s (%s)%n", change.getMonitorId(),
                    change.getFromStatus().getValue(), change.getToStatus().getValue(), change.getReason());
        }
    }
}
