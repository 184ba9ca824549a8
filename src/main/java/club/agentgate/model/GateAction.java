/**
 * 此文件定义了授权检查中的待执行动作，仅以类型字符串区分。
 */
package club.agentgate.model;

public record GateAction(String type) {}
