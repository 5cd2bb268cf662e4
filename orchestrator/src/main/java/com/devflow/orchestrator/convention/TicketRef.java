package com.devflow.orchestrator.convention;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * An issue-tracker key such as {@code TITAN-149}.
 *
 * Always held in normalised (uppercase) form.
 */
public record TicketRef(String key) {

    static final Pattern KEY = Pattern.compile("[A-Z]+-[0-9]+");

    public TicketRef {
        if (key == null || !KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Not a normalised ticket key: " + key);
        }
    }

    /**
     * Parse a whole string as a ticket key, ignoring case and surrounding
     * whitespace. Returns empty when the text is anything other than a key.
     */
    public static Optional<TicketRef> parse(String raw) {
        if (raw == null) return Optional.empty();
        String upper = raw.strip().toUpperCase(Locale.ROOT);
        return KEY.matcher(upper).matches() ? Optional.of(new TicketRef(upper)) : Optional.empty();
    }

    @Override
    public String toString() { return key; }
}
