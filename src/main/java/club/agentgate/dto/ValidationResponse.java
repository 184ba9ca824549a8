/**
 * 此文件定义了校验接口在负载通过时的响应体。
 */
package club.agentgate.dto;

public record ValidationResponse(boolean accepted, String target) {

    public static ValidationResponse accepted(String target) {
        return new ValidationResponse(true, target);
    }
}
