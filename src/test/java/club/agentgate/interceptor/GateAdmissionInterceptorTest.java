package club.agentgate.interceptor;

import club.agentgate.config.GateProperties;
import club.agentgate.controller.GateExceptionHandler;
import club.agentgate.controller.ValidationController;
import club.agentgate.scanner.RuleTables;
import club.agentgate.scanner.ThreatScanner;
import club.agentgate.service.BlockList;
import club.agentgate.service.RateLimiter;
import club.agentgate.service.SecurityGate;
import club.agentgate.service.SecurityMetrics;
import club.agentgate.service.auth.PermissionListAuthorizer;
import club.agentgate.service.auth.StaticCredentialAuthenticator;
import club.agentgate.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GateAdmissionInterceptorTest {

    private MutableClock clock;
    private SecurityGate gate;
    private GateAdmissionInterceptor interceptor;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochMillis(10_000);
        var properties = GateProperties.defaults().withRateLimit(2, 1000);
        var metrics = new SecurityMetrics(clock, 20);
        var scanner = new ThreatScanner(new ObjectMapper(), RuleTables.defaults(), metrics,
                properties.scan(), properties.resources());
        gate = new SecurityGate(
                new RateLimiter(properties.rateLimit().maxRequests(), properties.rateLimit().windowMs(), clock),
                new BlockList(properties.block().durationMs(), clock),
                scanner, metrics,
                new StaticCredentialAuthenticator("admin", "password"),
                new PermissionListAuthorizer());
        gate.initialize(properties);

        interceptor = new GateAdmissionInterceptor(gate, properties, clock);
        mvc = MockMvcBuilders.standaloneSetup(new ValidationController(gate))
                .addInterceptors(interceptor)
                .setControllerAdvice(new GateExceptionHandler())
                .build();
    }

    private MockHttpServletRequestBuilder input(String clientIp) {
        return post("/v1/gate/input")
                .header(GateAdmissionInterceptor.HEADER_X_FORWARDED_FOR, clientIp + ", 172.16.0.1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"q\":\"hello\"}");
    }

    @Test
    void allowedRequestCarriesRateLimitHeaders() throws Exception {
        mvc.perform(input("203.0.113.5"))
                .andExpect(status().isOk())
                .andExpect(header().string(GateAdmissionInterceptor.HEADER_REMAINING, "1"))
                .andExpect(header().string(GateAdmissionInterceptor.HEADER_RESET, "11000"));
    }

    @Test
    void requestsBeyondLimitGet429() throws Exception {
        mvc.perform(input("203.0.113.5")).andExpect(status().isOk());
        mvc.perform(input("203.0.113.5")).andExpect(status().isOk());

        mvc.perform(input("203.0.113.5"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string(GateAdmissionInterceptor.HEADER_REMAINING, "0"))
                .andExpect(jsonPath("$.code").value(429));

        mvc.perform(input("198.51.100.7")).andExpect(status().isOk());
    }

    @Test
    void repeatedRejectionsLeadToBlock() throws Exception {
        mvc.perform(input("203.0.113.5")).andExpect(status().isOk());
        mvc.perform(input("203.0.113.5")).andExpect(status().isOk());
        for (int i = 0; i < 3; i++) {
            mvc.perform(input("203.0.113.5")).andExpect(status().isTooManyRequests());
        }
        assertTrue(gate.isBlocked("203.0.113.5"));

        clock.advanceMillis(5_000);
        mvc.perform(input("203.0.113.5"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value(403));
    }

    @Test
    void acceptedRequestClearsRejectionStreak() throws Exception {
        mvc.perform(input("203.0.113.5")).andExpect(status().isOk());
        mvc.perform(input("203.0.113.5")).andExpect(status().isOk());
        mvc.perform(input("203.0.113.5")).andExpect(status().isTooManyRequests());
        mvc.perform(input("203.0.113.5")).andExpect(status().isTooManyRequests());

        clock.advanceMillis(1_001);
        mvc.perform(input("203.0.113.5")).andExpect(status().isOk());
        mvc.perform(input("203.0.113.5")).andExpect(status().isOk());
        mvc.perform(input("203.0.113.5")).andExpect(status().isTooManyRequests());

        assertFalse(gate.isBlocked("203.0.113.5"));
    }

    @Test
    void abandonedRejectionStreakIsEvictedAfterWindowEnds() throws Exception {
        mvc.perform(input("203.0.113.5")).andExpect(status().isOk());
        mvc.perform(input("203.0.113.5")).andExpect(status().isOk());
        mvc.perform(input("203.0.113.5")).andExpect(status().isTooManyRequests());
        assertEquals(1, interceptor.trackedRejectionStreaks());

        clock.setMillis(11_000);
        assertEquals(0, interceptor.evictExpiredRejections(), "window still open at its reset time");

        clock.setMillis(11_001);
        assertEquals(1, interceptor.evictExpiredRejections());
        assertEquals(0, interceptor.trackedRejectionStreaks());
    }

    @Test
    void evictionDoesNotShortenALiveStreak() throws Exception {
        mvc.perform(input("203.0.113.5")).andExpect(status().isOk());
        mvc.perform(input("203.0.113.5")).andExpect(status().isOk());
        mvc.perform(input("203.0.113.5")).andExpect(status().isTooManyRequests());
        mvc.perform(input("203.0.113.5")).andExpect(status().isTooManyRequests());

        clock.advanceMillis(500);
        assertEquals(0, interceptor.evictExpiredRejections());
        mvc.perform(input("203.0.113.5")).andExpect(status().isTooManyRequests());

        assertTrue(gate.isBlocked("203.0.113.5"));
    }

    @Test
    void preflightRequestsBypassAdmission() throws Exception {
        for (int i = 0; i < 5; i++) {
            mvc.perform(options("/v1/gate/input")
                    .header(GateAdmissionInterceptor.HEADER_X_FORWARDED_FOR, "203.0.113.5"));
        }

        assertEquals(0, gate.getRateLimitOverview().trackedIdentifiers());
    }

    @Test
    void remoteAddressIsUsedWithoutProxyHeader() throws Exception {
        mvc.perform(post("/v1/gate/input")
                        .with(request -> {
                            request.setRemoteAddr("192.0.2.44");
                            return request;
                        })
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"q\":\"hello\"}"))
                .andExpect(status().isOk());

        assertEquals(1, gate.getRateLimitOverview().trackedIdentifiers());
        assertFalse(gate.isBlocked("192.0.2.44"));
    }
}
