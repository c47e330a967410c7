package com.warden.security.password;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Facts about a user that must not appear in their password.
 */
public record PersonalInfo(String email, String firstName, String lastName) {

    private static final int MIN_FRAGMENT_LENGTH = 3;

    public static PersonalInfo none() {
        return new PersonalInfo(null, null, null);
    }

    /**
     * Lower-case fragments worth checking: email local part, first and last name, each at least
     * three characters long.
     */
    List<String> fragments() {
        List<String> fragments = new ArrayList<>();
        if (email != null && email.contains("@")) {
            add(fragments, email.substring(0, email.indexOf('@')));
        }
        add(fragments, firstName);
        add(fragments, lastName);
        return fragments;
    }

    private static void add(List<String> fragments, String value) {
        if (value != null && value.strip().length() >= MIN_FRAGMENT_LENGTH) {
            fragments.add(value.strip().toLowerCase(Locale.ROOT));
        }
    }
}
