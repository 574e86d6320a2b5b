package com.alertwarden.core.registry;

/**
 * No action group is registered under the requested id.
 *
 * @since 1.0.0
 */
public class ActionGroupNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String actionGroupId;

    public ActionGroupNotFoundException(String actionGroupId) {
        super("Action group not found: '" + actionGroupId + "'");
        this.actionGroupId = actionGroupId;
    }

    public String getActionGroupId() {
        return actionGroupId;
    }
}
