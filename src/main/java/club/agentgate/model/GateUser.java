/**
 * 此文件定义了授权检查中的用户及其权限列表。
 */
package club.agentgate.model;

import java.util.List;

public record GateUser(String id, List<String> permissions) {}
