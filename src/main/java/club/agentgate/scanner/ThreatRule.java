/**
 * 此文件定义了规则表中的一条规则: 规则标识、匹配器、严重程度与分类。
 *
 * 扫描阶段只遍历规则表，不内联任何模式字面量，因此替换或扩展规则无需改动扫描流程。
 *
 * 关联:
 * - `RuleTables`: 构建默认规则表。
 * - 各扫描阶段: 在序列化后的负载文本上执行 `matches`。
 */
package club.agentgate.scanner;

import club.agentgate.model.Severity;
import java.util.regex.Pattern;

public record ThreatRule(String id, Pattern pattern, Severity severity, RuleCategory category) {

    /**
     * 以忽略大小写的方式编译正则并创建规则。
     */
    public static ThreatRule of(String id, String regex, Severity severity, RuleCategory category) {
        return new ThreatRule(id, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), severity, category);
    }

    public boolean matches(CharSequence text) {
        return pattern.matcher(text).find();
    }

    @Override
    public String toString() {
        return id + "(" + severity.code() + ")";
    }
}
