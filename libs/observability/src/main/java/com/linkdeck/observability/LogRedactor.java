package com.linkdeck.observability;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps identity values out of plain logs.
 * <p>
 * Identifiers (user IDs, org IDs) are shortened and email addresses masked, so a log line is
 * still enough to start an investigation without carrying the full value.
 */
public final class LogRedactor {

    /** Number of leading characters kept by {@link #truncate(String)}. */
    public static final int VISIBLE_PREFIX = 8;

    private static final String ELLIPSIS = "…";

    private static final Pattern EMAIL = Pattern.compile("[^\\s@:;,\"'<>()]+@[^\\s@:;,\"'<>()]+");

    private LogRedactor() {
    }

    /**
     * Shortens an identifier to its first {@value #VISIBLE_PREFIX} characters followed by an
     * ellipsis. Short values are returned unchanged; null becomes {@code "-"}.
     */
    public static String truncate(String identifier) {
        if (identifier == null) {
            return "-";
        }
        if (identifier.length() <= VISIBLE_PREFIX) {
            return identifier;
        }
        return identifier.substring(0, VISIBLE_PREFIX) + ELLIPSIS;
    }

    /**
     * Masks the local part of an email address, keeping its first two characters and the
     * domain: {@code "jane.doe@example.com"} becomes {@code "ja***@example.com"}.
     */
    public static String maskEmail(String email) {
        if (email == null) {
            return "-";
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return truncate(email);
        }
        String local = email.substring(0, at);
        String visible = local.length() <= 2 ? local.substring(0, 1) : local.substring(0, 2);
        return visible + "***" + email.substring(at);
    }

    /**
     * Masks every email address found in free text, such as an exception message, with
     * {@link #maskEmail(String)}. Null becomes {@code "-"}.
     */
    public static String maskEmails(String text) {
        if (text == null) {
            return "-";
        }
        Matcher matcher = EMAIL.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(maskEmail(matcher.group())));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
