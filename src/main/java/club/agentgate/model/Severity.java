/**
 * 此文件定义了安全事件的严重程度，以及指标快照中的威胁/漏洞等级。
 *
 * 序列化为JSON时使用小写名称(`low`, `medium`, `high`, `critical`)。
 */
package club.agentgate.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
