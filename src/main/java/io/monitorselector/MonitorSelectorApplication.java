package io.monitorselector;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.monitorselector.config.SelectorConfig;
import io.monitorselector.constraints.AccountLimitPolicy;
import io.monitorselector.constraints.ConstraintEngine;
import io.monitorselector.metrics.SelectorMetrics;
import io.monitorselector.processing.ServerProcessor;
import io.monitorselector.processing.ViolationTracker;
import io.monitorselector.selection.GrandfatheringPolicy;
import io.monitorselector.selection.SelectionRuleEngine;
import io.monitorselector.selection.StateClassifier;
import io.monitorselector.store.MonitorStore;
import io.monitorselector.util.EnvironmentUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.ParseException;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Primary;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.PrintWriter;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Main Spring Boot application class for the NTP monitor selector.
 *
 * The command line is parsed before the context starts; the chosen command is executed by
 * {@link SelectorRunner} once every bean is ready. The embedded web server only carries the
 * metrics scrape and health endpoints.
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "io.monitorselector")
public class MonitorSelectorApplication {

    static final String METRICS_PORT_PROPERTY = "selector.metrics-port";
    static final String CONSOLE_PATTERN_PROPERTY = "logging.pattern.console";
    static final String MANAGED_CONSOLE_PATTERN = "%-5level [%thread] %logger{36} - %msg%n";

    public static void main(String[] args) {
        if (SelectorCommandLine.isHelpRequested(args)) {
            SelectorCommandLine.printHelp(new PrintWriter(System.out));
            return;
        }

        SelectorCommandLine commandLine;
        try {
            commandLine = SelectorCommandLine.parse(args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            SelectorCommandLine.printHelp(new PrintWriter(System.err));
            System.exit(2);
            return;
        }

        log.info("Starting Monitor Selector: command={}, metricsPort={}", commandLine.getCommand(), commandLine.getMetricsPort());
        try {
            SpringApplication application = new SpringApplication(MonitorSelectorApplication.class);
            application.setDefaultProperties(defaultProperties(commandLine, EnvironmentUtils.isManagedService()));
            application.addInitializers(context ->
                    context.getBeanFactory().registerSingleton("selectorCommandLine", commandLine));
            ConfigurableApplicationContext context = application.run(commandLine.getSpringArgs());

            if (!commandLine.isServerMode()) {
                System.exit(SpringApplication.exit(context));
            }
            log.info("Monitor Selector started successfully");
        } catch (Exception e) {
            log.error("Failed to start Monitor Selector: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static Map<String, Object> defaultProperties(SelectorCommandLine commandLine, boolean managedService) {
        Map<String, Object> properties = new HashMap<>();
        properties.put(METRICS_PORT_PROPERTY, commandLine.getMetricsPort());
        if (managedService) {
            // the service manager timestamps every line itself
            properties.put(CONSOLE_PATTERN_PROPERTY, MANAGED_CONSOLE_PATTERN);
        }
        return properties;
    }

    @Bean
    @Primary
    public SelectorConfig config() {
        SelectorConfig config = new SelectorConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PrometheusMeterRegistry prometheusMeterRegistry() {
        log.info("Initializing Prometheus meter registry");
        return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public ConstraintEngine constraintEngine(Clock clock) {
        log.info("Initializing ConstraintEngine");
        return new ConstraintEngine(clock);
    }

    @Bean
    public AccountLimitPolicy accountLimitPolicy(ObjectMapper objectMapper, Clock clock) {
        return new AccountLimitPolicy(objectMapper, clock);
    }

    @Bean
    public GrandfatheringPolicy grandfatheringPolicy() {
        return new GrandfatheringPolicy();
    }

    @Bean
    public StateClassifier stateClassifier() {
        return new StateClassifier();
    }

    @Bean
    public SelectionRuleEngine selectionRuleEngine(ConstraintEngine constraintEngine, SelectorConfig config) {
        log.info("Initializing SelectionRuleEngine");
        return new SelectionRuleEngine(constraintEngine, config.getSelectionSettings());
    }

    @Bean
    public ViolationTracker violationTracker(MonitorStore monitorStore, Clock clock, SelectorConfig config) {
        return new ViolationTracker(monitorStore, clock, config.getRecheckPausedInterval());
    }

    @Bean
    public ServerProcessor serverProcessor(MonitorStore monitorStore,
                                           ConstraintEngine constraintEngine,
                                           AccountLimitPolicy accountLimitPolicy,
                                           GrandfatheringPolicy grandfatheringPolicy,
                                           StateClassifier stateClassifier,
                                           SelectionRuleEngine selectionRuleEngine,
                                           ViolationTracker violationTracker,
                                           SelectorMetrics selectorMetrics,
                                           SelectorConfig config,
                                           Clock clock) {
        log.info("Initializing ServerProcessor");
        return new ServerProcessor(monitorStore, constraintEngine, accountLimitPolicy, grandfatheringPolicy,
                stateClassifier, selectionRuleEngine, violationTracker, selectorMetrics, config, clock);
    }

    /**
     * The driver is started by {@link SelectorRunner} in server mode and stopped when the context closes.
     */
    @Bean(destroyMethod = "stop")
    public MonitorSelector monitorSelector(MonitorStore monitorStore,
                                           ServerProcessor serverProcessor,
                                           TransactionTemplate transactionTemplate,
                                           SelectorConfig config,
                                           Clock clock) {
        log.info("Initializing MonitorSelector");
        return new MonitorSelector(monitorStore, serverProcessor, transactionTemplate, config, clock);
    }

    @Bean
    public SelectorRunner selectorRunner(SelectorCommandLine selectorCommandLine, MonitorSelector monitorSelector) {
        return new SelectorRunner(selectorCommandLine, monitorSelector, System.out);
    }
}
