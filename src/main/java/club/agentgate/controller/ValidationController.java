/**
 * 此文件定义了网关校验与认证相关的API端点。
 *
 * 主要职责:
 * - `/v1/gate/input`, `/v1/gate/action-plan`, `/v1/gate/solution`: 将JSON请求体交给对应的校验入口。
 *   校验失败时由 `GateExceptionHandler` 转换为错误响应。
 * - `/v1/gate/authenticate`, `/v1/gate/authorize`: 返回布尔结果，失败不是异常。
 *
 * 关联:
 * - `SecurityGate`: 核心逻辑的实现，由本Controller调用。
 * - `GateAdmissionInterceptor`: 所有 `/v1/**` 请求在到达这里之前已经过准入检查。
 */
package club.agentgate.controller;

import club.agentgate.dto.AuthorizeRequest;
import club.agentgate.dto.ValidationResponse;
import club.agentgate.model.Credentials;
import club.agentgate.service.SecurityGate;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/gate")
public class ValidationController {

    private static final Logger logger = LoggerFactory.getLogger(ValidationController.class);

    private final SecurityGate securityGate;

    public ValidationController(SecurityGate securityGate) {
        this.securityGate = securityGate;
    }

    @PostMapping("/input")
    public ValidationResponse validateInput(@RequestBody JsonNode payload) {
        logger.info("接收到输入校验请求: POST /v1/gate/input");
        securityGate.validateInput(payload);
        return ValidationResponse.accepted("input");
    }

    @PostMapping("/action-plan")
    public ValidationResponse validateActionPlan(@RequestBody JsonNode plan) {
        logger.info("接收到行动计划校验请求: POST /v1/gate/action-plan");
        securityGate.validateActionPlan(plan);
        return ValidationResponse.accepted("action-plan");
    }

    @PostMapping("/solution")
    public ValidationResponse validateSolution(@RequestBody JsonNode solution) {
        logger.info("接收到解决方案校验请求: POST /v1/gate/solution");
        securityGate.validateSolution(solution);
        return ValidationResponse.accepted("solution");
    }

    @PostMapping("/authenticate")
    public Map<String, Boolean> authenticate(@RequestBody Credentials credentials) {
        return Map.of("authenticated", securityGate.authenticate(credentials));
    }

    @PostMapping("/authorize")
    public Map<String, Boolean> authorize(@RequestBody AuthorizeRequest request) {
        return Map.of("authorized", securityGate.authorize(request.user(), request.action()));
    }
}
