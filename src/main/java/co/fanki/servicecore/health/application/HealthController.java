package co.fanki.servicecore.health.application;

import co.fanki.servicecore.health.domain.PingReport;
import co.fanki.servicecore.health.domain.ServiceUptime;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health check controller providing endpoints for liveness and readiness
 * probes.
 *
 * <p>Provides /ping with uptime information for liveness checks and
 * /health as a lightweight readiness check for Docker and Kubernetes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Health", description = "Liveness and readiness probes")
public class HealthController {

    private static final Logger LOG = LoggerFactory.getLogger(
            HealthController.class);

    private static final HealthResponse OK = new HealthResponse("ok");

    private final ServiceUptime serviceUptime;

    /**
     * Creates a new HealthController.
     *
     * @param theServiceUptime the uptime tracker
     */
    public HealthController(final ServiceUptime theServiceUptime) {
        this.serviceUptime = theServiceUptime;
    }

    /**
     * Liveness probe endpoint.
     *
     * @return the status with uptime and current timestamp
     */
    @Operation(
            summary = "Ping endpoint",
            description = "Health check endpoint for readiness/liveness probes."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Service is alive",
                    content = @Content(schema = @Schema(
                            implementation = PingReport.class)))
    })
    @GetMapping("/ping")
    public ResponseEntity<PingReport> ping() {
        final PingReport report = serviceUptime.ping();
        LOG.trace("Ping answered, uptime {}s", report.uptime());
        return ResponseEntity.ok(report);
    }

    /**
     * Readiness probe endpoint.
     *
     * @return the status
     */
    @Operation(
            summary = "Health check endpoint",
            description = "Lightweight healthcheck endpoint for Docker/K8s."
    )
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(OK);
    }

    /**
     * Response of the readiness probe.
     *
     * @param status the status token
     */
    public record HealthResponse(
            String status
    ) {}

}
