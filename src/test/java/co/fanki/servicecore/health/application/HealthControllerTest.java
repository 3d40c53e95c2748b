package co.fanki.servicecore.health.application;

import co.fanki.servicecore.health.domain.PingReport;
import co.fanki.servicecore.health.domain.ServiceUptime;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for {@link HealthController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ServiceUptime serviceUptime;

    @Test
    void whenPinging_givenRunningService_shouldReturnUptimeReport()
            throws Exception {
        when(serviceUptime.ping()).thenReturn(
                PingReport.ok(42L, 1_700_000_042L));

        mockMvc.perform(get("/api/v1/ping"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.uptime").value(42))
                .andExpect(jsonPath("$.timestamp").value(1_700_000_042L));
    }

    @Test
    void whenCheckingHealth_givenAnyTime_shouldReturnOnlyOkStatus()
            throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(content().json("{\"status\":\"ok\"}", true));

        verify(serviceUptime, never()).ping();
    }

    @Test
    void whenCheckingHealth_givenWrongMethod_shouldRenderErrorPayload()
            throws Exception {
        mockMvc.perform(post("/api/v1/health"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").exists());
    }

}
