package queryrouter.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.bind.annotation.Bindable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Immutable configuration properties for the query router.
 * Maps to the 'router' prefix in application.yml.
 */
@ConfigurationProperties("router")
public record RouterProperties(
        @PositiveOrZero @Bindable(defaultValue = "30000") long defaultTimeoutMs,
        EnginesConfig engines,
        ExecutorConfig executor,
        ErrorHandlingConfig errorHandling
) {

    public RouterProperties {
        engines = engines != null ? engines : new EnginesConfig("Transactional", "Analytical", 30);
        executor = executor != null ? executor : new ExecutorConfig(0, "router-query");
        errorHandling = errorHandling != null ? errorHandling : new ErrorHandlingConfig(false, false);
    }

    /**
     * @param transactionalName       diagnostic name of the engine serving point operations
     * @param analyticalName          diagnostic name of the engine serving scans, joins and aggregates
     * @param statementTimeoutSeconds JDBC timeout used when a call carries no deadline, 0 for none
     */
    @ConfigurationProperties("engines")
    public record EnginesConfig(
            @NotBlank @Bindable(defaultValue = "Transactional") String transactionalName,
            @NotBlank @Bindable(defaultValue = "Analytical") String analyticalName,
            @PositiveOrZero @Bindable(defaultValue = "30") int statementTimeoutSeconds
    ) {
        public EnginesConfig {
            transactionalName = defaultIfBlank(transactionalName, "Transactional");
            analyticalName = defaultIfBlank(analyticalName, "Analytical");
        }
    }

    /**
     * @param maxThreads       upper bound of the request executor, 0 to size from available processors
     * @param threadNamePrefix prefix for executor thread names
     */
    @ConfigurationProperties("executor")
    public record ExecutorConfig(
            @PositiveOrZero @Bindable(defaultValue = "0") int maxThreads,
            @Bindable(defaultValue = "router-query") String threadNamePrefix
    ) {
        public ExecutorConfig {
            threadNamePrefix = defaultIfBlank(threadNamePrefix, "router-query");
        }

        public int effectiveMaxThreads() {
            return maxThreads > 0 ? maxThreads : Math.max(16, Runtime.getRuntime().availableProcessors() * 2);
        }
    }

    @ConfigurationProperties("error-handling")
    public record ErrorHandlingConfig(
            @Bindable(defaultValue = "false") boolean exposeDetails,
            @Bindable(defaultValue = "false") boolean exposeStackTrace
    ) {
        /**
         * @param exposeDetails    Whether to expose engine names and failure messages to clients.
         *                         Recommended: false in production, true in development.
         * @param exposeStackTrace Whether to include stack traces in error responses.
         *                         If false, stack traces are only logged server-side.
         */
        public ErrorHandlingConfig {
        }
    }

    private static String defaultIfBlank(String value, String defaultValue) {
        return (value == null || value.isBlank()) ? defaultValue : value;
    }
}
