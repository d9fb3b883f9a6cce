package com.libragraph.chatvault.formats.peer;

import java.util.Objects;

/**
 * A chat counterpart: user, group or channel. Absent fields are empty strings, never null.
 */
public record Peer(String firstName, String lastName, String username, String title, String phone) {

    public static final Peer EMPTY = new Peer("", "", "", "", "");

    public Peer {
        firstName = Objects.requireNonNullElse(firstName, "");
        lastName = Objects.requireNonNullElse(lastName, "");
        username = Objects.requireNonNullElse(username, "");
        title = Objects.requireNonNullElse(title, "");
        phone = Objects.requireNonNullElse(phone, "");
    }

    /**
     * Title for groups and channels; otherwise the person's name, then
     * {@code @username}, then {@code "Unknown"}.
     */
    public String displayName() {
        if (!title.isEmpty()) {
            return title;
        }
        String name = (firstName + " " + lastName).strip();
        if (!name.isEmpty()) {
            return name;
        }
        if (!username.isEmpty()) {
            return "@" + username;
        }
        return "Unknown";
    }

    /** Phone number reduced to its digits. */
    public String phoneDigits() {
        return digitsOf(phone);
    }

    public static String digitsOf(String text) {
        StringBuilder digits = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.toString();
    }
}
