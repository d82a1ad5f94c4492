// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core;

import java.util.regex.Pattern;

/**
 * Removes sensitive data from debug log payloads.
 *
 * <p>
 * Vault implementations may surface signer material in exception messages that end up
 * in withdrawal traces. Private keys are redacted and oversized messages truncated.
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern PRIVATE_KEY_PATTERN =
            Pattern.compile("\"privateKey\"\\s*:\\s*\"0x[^\"]+\"");

    private static final String PRIVATE_KEY_REPLACEMENT = "\"privateKey\":\"0x***[REDACTED]***\"";

    private static final Pattern BARE_KEY_PATTERN =
            Pattern.compile("(?i)privateKey=0x[0-9a-f]+");

    private static final String BARE_KEY_REPLACEMENT = "privateKey=0x***[REDACTED]***";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"privateKey\"")) {
            sanitized = PRIVATE_KEY_PATTERN.matcher(sanitized).replaceAll(PRIVATE_KEY_REPLACEMENT);
        }
        sanitized = BARE_KEY_PATTERN.matcher(sanitized).replaceAll(BARE_KEY_REPLACEMENT);

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
