package com.alertwarden.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * SMS receiver. Country code and number must both be plain digits; a leading
 * {@code +} on the country code is tolerated and stripped.
 *
 * @since 1.0.0
 */
public final class SmsReceiver extends Receiver {

    private final String countryCode;
    private final String phoneNumber;

    public SmsReceiver(String name, String countryCode, String phoneNumber) {
        super(name);
        this.countryCode = countryCode != null && countryCode.startsWith("+")
                ? countryCode.substring(1)
                : countryCode;
        this.phoneNumber = phoneNumber;
    }

    public String getCountryCode() {
        return countryCode;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    @Override
    public Kind kind() {
        return Kind.SMS;
    }

    @Override
    public String target() {
        return "+" + countryCode + phoneNumber;
    }

    @Override
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (!isDigits(countryCode) || countryCode.length() > 3) {
            problems.add("SMS receiver '" + getName() + "' has a malformed country code: '" + countryCode + "'");
        }
        if (!isDigits(phoneNumber)) {
            problems.add("SMS receiver '" + getName() + "' has non-numeric phone digits: '" + phoneNumber + "'");
        }
        return problems;
    }
}
