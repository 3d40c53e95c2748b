package co.fanki.servicecore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Service Core Application.
 *
 * <p>This is the main entry point for the Service Core, which exposes
 * liveness and readiness probes and reports every failure through a single
 * structured error model.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class ServiceCoreApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(ServiceCoreApplication.class, args);
    }

}
