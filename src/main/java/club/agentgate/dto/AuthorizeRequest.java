/**
 * 此文件定义了 `/v1/gate/authorize` 的请求体。
 */
package club.agentgate.dto;

import club.agentgate.model.GateAction;
import club.agentgate.model.GateUser;

public record AuthorizeRequest(GateUser user, GateAction action) {}
