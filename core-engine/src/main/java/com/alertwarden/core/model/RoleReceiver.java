package com.alertwarden.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Role-based receiver: everyone holding the role is notified by the delivery
 * collaborator.
 *
 * @since 1.0.0
 */
public final class RoleReceiver extends Receiver {

    private final String roleId;

    public RoleReceiver(String name, String roleId) {
        super(name);
        this.roleId = roleId != null ? roleId.trim() : null;
    }

    public String getRoleId() {
        return roleId;
    }

    @Override
    public Kind kind() {
        return Kind.ROLE;
    }

    @Override
    public String target() {
        return roleId;
    }

    @Override
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (isBlank(roleId)) {
            problems.add("Role receiver '" + getName() + "' has an empty role id");
        }
        return problems;
    }
}
