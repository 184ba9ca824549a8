/**
 * 占位认证实现: 与配置中的一对固定用户名/密码做精确比较。
 *
 * 这不是生产级认证，仅用于在接入真实凭据后端之前保持接口可用。
 */
package club.agentgate.service.auth;

import club.agentgate.model.Credentials;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

public class StaticCredentialAuthenticator implements Authenticator {

    private final String username;
    private final String password;

    public StaticCredentialAuthenticator(String username, String password) {
        this.username = username;
        this.password = password;
    }

    @Override
    public boolean authenticate(Credentials credentials) {
        if (credentials == null || isBlank(credentials.username()) || isBlank(credentials.password())) {
            return false;
        }
        return username.equals(credentials.username())
                && MessageDigest.isEqual(
                        password.getBytes(StandardCharsets.UTF_8),
                        credentials.password().getBytes(StandardCharsets.UTF_8));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
