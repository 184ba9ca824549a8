/**
 * 此接口定义了凭据校验的扩展点。
 *
 * 网关只依赖此接口，替换为真实的凭据后端不需要改动扫描流程。
 *
 * 关联:
 * - `StaticCredentialAuthenticator`: 默认的占位实现。
 * - `SecurityGate#authenticate`: 调用此接口并在失败时更新安全指标。
 */
package club.agentgate.service.auth;

import club.agentgate.model.Credentials;

public interface Authenticator {

    /**
     * @param credentials 待校验的凭据，不为null。
     * @return 凭据有效时返回`true`。
     */
    boolean authenticate(Credentials credentials);
}
