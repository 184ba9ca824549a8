/**
 * 占位授权实现: 动作类型出现在用户的权限列表中即视为授权。
 */
package club.agentgate.service.auth;

import club.agentgate.model.GateAction;
import club.agentgate.model.GateUser;

public class PermissionListAuthorizer implements Authorizer {

    @Override
    public boolean authorize(GateUser user, GateAction action) {
        if (user == null || user.permissions() == null || action == null || action.type() == null) {
            return false;
        }
        return user.permissions().contains(action.type());
    }
}
