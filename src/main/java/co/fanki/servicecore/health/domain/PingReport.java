package co.fanki.servicecore.health.domain;

import co.fanki.servicecore.shared.Preconditions;
import co.fanki.servicecore.shared.ValueObject;

/**
 * Liveness report of the running service.
 *
 * @param status the status token, always {@code ok} while the process
 *     answers
 * @param uptime the seconds elapsed since the service started
 * @param timestamp the epoch second the report was taken at
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PingReport(
        String status,
        long uptime,
        long timestamp
) implements ValueObject {

    /** Status reported while the service is running. */
    public static final String OK = "ok";

    /**
     * Validates the report.
     */
    public PingReport {
        Preconditions.requireNonBlank(status, "Status is required");
        Preconditions.requireNonNegative(uptime, "Uptime cannot be negative");
    }

    /**
     * Creates a report for a running service.
     *
     * @param uptime the seconds elapsed since start
     * @param timestamp the current epoch second
     * @return the report
     */
    public static PingReport ok(final long uptime, final long timestamp) {
        return new PingReport(OK, uptime, timestamp);
    }

}
