/**
 * 此接口定义了动作授权的扩展点。
 *
 * 关联:
 * - `PermissionListAuthorizer`: 默认的占位实现。
 * - `SecurityGate#authorize`: 调用此接口并在失败时更新安全指标。
 */
package club.agentgate.service.auth;

import club.agentgate.model.GateAction;
import club.agentgate.model.GateUser;

public interface Authorizer {

    boolean authorize(GateUser user, GateAction action);
}
