/**
 * 此文件定义了认证请求携带的凭据。
 *
 * 重写了 `toString` 以避免密码出现在日志中。
 */
package club.agentgate.model;

public record Credentials(String username, String password) {

    @Override
    public String toString() {
        return "Credentials{username='" + username + "', password='***'}";
    }
}
