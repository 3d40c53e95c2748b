package co.fanki.servicecore.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Service Core.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8001}")
    private int serverPort;

    @Value("${service.version:0.0.1}")
    private String serviceVersion;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Service Core API")
                        .description("""
                                Service Core - health probes and the structured error
                                model shared by every endpoint.

                                ## Probes
                                - `GET /api/v1/ping` - liveness, with uptime and timestamp
                                - `GET /api/v1/health` - lightweight readiness check

                                ## Errors
                                Every failure is returned as `{code, message, details}`
                                where `code` is a stable identifier such as
                                `CLIENT_INITIALIZATION_ERROR`.
                                """)
                        .version(serviceVersion)
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
