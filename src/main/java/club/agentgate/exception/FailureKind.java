/**
 * 此文件定义了负载校验失败的类别。
 */
package club.agentgate.exception;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FailureKind {
    CONTENT,
    STRUCTURE,
    INJECTION,
    PERMISSION,
    RESOURCE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
