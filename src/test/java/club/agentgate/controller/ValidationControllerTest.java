package club.agentgate.controller;

import club.agentgate.config.GateProperties;
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
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ValidationControllerTest {

    private final MutableClock clock = MutableClock.atEpochMillis(0);
    private final SecurityMetrics metrics = new SecurityMetrics(clock, 20);

    private SecurityGate newGate() {
        var properties = GateProperties.defaults();
        var scanner = new ThreatScanner(new ObjectMapper(), RuleTables.defaults(), metrics,
                properties.scan(), properties.resources());
        return new SecurityGate(new RateLimiter(100, 60_000, clock), new BlockList(300_000, clock),
                scanner, metrics, new StaticCredentialAuthenticator("admin", "password"),
                new PermissionListAuthorizer());
    }

    private MockMvc mvc(SecurityGate gate) {
        return MockMvcBuilders.standaloneSetup(new ValidationController(gate))
                .setControllerAdvice(new GateExceptionHandler())
                .build();
    }

    private MockMvc initializedMvc() {
        var gate = newGate();
        gate.initialize(GateProperties.defaults().withUserPermissions(List.of("read", "write")));
        return mvc(gate);
    }

    @Test
    void cleanInputIsAccepted() throws Exception {
        initializedMvc().perform(post("/v1/gate/input")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"weather in Lisbon\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.target").value("input"));
    }

    @Test
    void maliciousInputReturns422WithKind() throws Exception {
        initializedMvc().perform(post("/v1/gate/input")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"<script>alert(1)</script>\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value(422))
                .andExpect(jsonPath("$.kind").value("content"));
    }

    @Test
    void injectionReturnsInjectionKind() throws Exception {
        initializedMvc().perform(post("/v1/gate/input")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"x' OR '1'='1\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("injection"));
    }

    @Test
    void actionPlanWithUngrantedPermissionIsRejected() throws Exception {
        initializedMvc().perform(post("/v1/gate/action-plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"permissions\":[\"admin\"]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("permission"));
    }

    @Test
    void actionPlanOverResourceCeilingIsRejected() throws Exception {
        initializedMvc().perform(post("/v1/gate/action-plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resources\":{\"cpu\":400}}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("resource"));
    }

    @Test
    void solutionWithFindingsIsStillAccepted() throws Exception {
        initializedMvc().perform(post("/v1/gate/solution")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"an unsafe shortcut\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.target").value("solution"));
    }

    @Test
    void uninitializedGateReturns503() throws Exception {
        mvc(newGate()).perform(post("/v1/gate/input")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"hello\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.kind").value("not_initialized"));
    }

    @Test
    void unreadableBodyReturns400() throws Exception {
        initializedMvc().perform(post("/v1/gate/input")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("malformed_request"));
    }

    @Test
    void authenticateReturnsBoolean() throws Exception {
        var mvc = initializedMvc();

        mvc.perform(post("/v1/gate/authenticate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"admin\",\"password\":\"password\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(true));
        mvc.perform(post("/v1/gate/authenticate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"admin\",\"password\":\"nope\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(false));
    }

    @Test
    void authorizeReturnsBoolean() throws Exception {
        initializedMvc().perform(post("/v1/gate/authorize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"user": {"id": "agent-1", "permissions": ["read"]},
                                 "action": {"type": "write"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authorized").value(false));
    }
}
