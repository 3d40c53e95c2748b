package co.fanki.servicecore.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time source configuration.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class ClockConfiguration {

    /**
     * Provides the system clock in UTC.
     *
     * @return the clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

}
