/**
 * 此文件定义了负载未通过安全校验时抛出的异常。
 *
 * 调用方应把它视为"拒绝此负载"，而不是重试。抛出之前，对应的安全事件已经写入 `SecurityMetrics`。
 *
 * 关联:
 * - 各扫描阶段: 在匹配到第一条规则时抛出。
 * - `GateExceptionHandler`: 转换为HTTP 422响应。
 */
package club.agentgate.exception;

public class ValidationFailureException extends RuntimeException {

    private final FailureKind kind;
    private final String detail;

    public ValidationFailureException(FailureKind kind, String detail) {
        super(kind.code() + ": " + detail);
        this.kind = kind;
        this.detail = detail;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getDetail() {
        return detail;
    }
}
