package queryrouter.controller;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * Request body for the query endpoints.
 *
 * @param query     statement text
 * @param args      positional parameters for {@code ?} placeholders
 * @param explain   attach the plan explanation to the result
 * @param timeoutMs per-call timeout, 0 for none, absent for the configured default
 */
@Serdeable
public record QueryRequest(
        @NotBlank String query,
        @Nullable List<Object> args,
        @Nullable Boolean explain,
        @Nullable @PositiveOrZero Long timeoutMs
) {

    public boolean explainRequested() {
        return Boolean.TRUE.equals(explain);
    }
}
