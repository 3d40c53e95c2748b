package co.fanki.servicecore.health.domain;

import co.fanki.servicecore.shared.Preconditions;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Tracks how long the service has been running.
 *
 * <p>The start instant is taken from the clock when this component is
 * created, which happens while the application context starts.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class ServiceUptime {

    private final Clock clock;

    private final Instant startedAt;

    /**
     * Creates a new ServiceUptime starting now.
     *
     * @param theClock the clock to read time from
     */
    public ServiceUptime(final Clock theClock) {
        this.clock = Preconditions.requireNonNull(theClock,
                "Clock is required");
        this.startedAt = clock.instant();
    }

    /**
     * Returns the instant the service started at.
     *
     * @return the start instant
     */
    public Instant startedAt() {
        return startedAt;
    }

    /**
     * Takes a liveness report.
     *
     * <p>Uptime is whole seconds between the start and now, in epoch
     * seconds. It is reported as zero if the clock went backwards.</p>
     *
     * @return the report
     */
    public PingReport ping() {
        final long now = clock.instant().getEpochSecond();
        final long uptime = Math.max(0L, now - startedAt.getEpochSecond());
        return PingReport.ok(uptime, now);
    }

}
