/**
 * 此文件定义了扫描规则的分类，用于规则表的组织和事件类型的选择。
 */
package club.agentgate.scanner;

public enum RuleCategory {
    // 内容扫描
    MARKUP,
    DYNAMIC_EVAL,
    SHELL_ACCESS,
    FILE_ACCESS,

    // 注入扫描
    SQL,
    SHELL_COMMAND,

    // 行动计划
    SENSITIVE_ACTION,
    DANGEROUS_ACTION,

    // 解决方案安全
    HARM,
    ETHICS
}
