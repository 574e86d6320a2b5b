package com.alertwarden.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Email receiver.
 *
 * @since 1.0.0
 */
public final class EmailReceiver extends Receiver {

    private final String address;

    public EmailReceiver(String name, String address) {
        super(name);
        this.address = address != null ? address.trim() : null;
    }

    public String getAddress() {
        return address;
    }

    @Override
    public Kind kind() {
        return Kind.EMAIL;
    }

    @Override
    public String target() {
        return address;
    }

    @Override
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (isBlank(address)) {
            problems.add("Email receiver '" + getName() + "' has an empty address");
            return problems;
        }
        int at = address.indexOf('@');
        if (at <= 0 || at != address.lastIndexOf('@') || at == address.length() - 1
                || address.chars().anyMatch(Character::isWhitespace)) {
            problems.add("Email receiver '" + getName() + "' has a malformed address: '" + address + "'");
        }
        return problems;
    }
}
