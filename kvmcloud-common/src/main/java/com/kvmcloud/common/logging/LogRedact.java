package com.kvmcloud.common.logging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Credential redaction for log output.
 * Device secret tokens and operator identity tokens must never reach the log
 * verbatim; they are masked down to a short prefix and suffix.
 */
public final class LogRedact {

    private LogRedact() {
    }

    // -----------------------------------------------------------------------
    // Constants
    // -----------------------------------------------------------------------

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;

    private static final List<String> DEFAULT_PATTERN_SOURCES = List.of(
            // Authorization headers
            "Authorization\\s*[:=]\\s*(?:[A-Za-z]+\\s+)?([^\\s,]+)",
            "\\bBearer\\s+([A-Za-z0-9._\\-+=/]{18,})",
            // JSON fields carrying credentials on the signaling wire
            "\"(?:token|secretToken|idToken|id_token|OidcGoogle)\"\\s*:\\s*\"([^\"]+)\"",
            // Query parameters
            "[?&](?:token|access_token)=([^&\\s]+)",
            // Compact JWTs anywhere in free text
            "\\b(eyJ[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]*)");

    private static final List<Pattern> DEFAULT_PATTERNS;
    static {
        List<Pattern> compiled = new ArrayList<>();
        for (String src : DEFAULT_PATTERN_SOURCES) {
            compiled.add(Pattern.compile(src, Pattern.CASE_INSENSITIVE));
        }
        DEFAULT_PATTERNS = Collections.unmodifiableList(compiled);
    }

    // -----------------------------------------------------------------------
    // Public API
    // -----------------------------------------------------------------------

    /**
     * Redact credentials found anywhere in {@code text}.
     */
    public static String redactSensitiveText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Pattern pattern : DEFAULT_PATTERNS) {
            result = redactWithPattern(result, pattern);
        }
        return result;
    }

    /**
     * Mask a single token, preserving start/end characters.
     * {@code null} stays {@code null} so callers can log optional values directly.
     */
    public static String maskToken(String token) {
        if (token == null) {
            return null;
        }
        if (token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        String start = token.substring(0, KEEP_START);
        String end = token.substring(token.length() - KEEP_END);
        return start + "…" + end;
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private static String redactWithPattern(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String fullMatch = matcher.group(0);
            String token = matcher.groupCount() >= 1 && matcher.group(1) != null
                    ? matcher.group(1)
                    : fullMatch;
            String replacement = token.equals(fullMatch)
                    ? maskToken(token)
                    : fullMatch.replace(token, maskToken(token));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
