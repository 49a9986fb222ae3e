package io.github.drompincen.eligibility.runtime.guardrail;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks personal data in user-facing text. Bracketed tokens such as citation markers are left
 * untouched.
 */
public final class PiiRedactor {

    public enum Level {
        OFF,
        STANDARD,
        STRICT;

        public static Level parse(String value) {
            if (value == null || value.isBlank()) return STANDARD;
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "off", "none" -> OFF;
                case "strict" -> STRICT;
                default -> STANDARD;
            };
        }
    }

    private static final Pattern BRACKETS = Pattern.compile("\\[[^\\[\\]]*\\]");
    private static final Pattern EMAIL = Pattern.compile("[\\w.-]+@[\\w.-]+");
    private static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d\\s\\-()]{6,}\\d");
    private static final Pattern DONOR_ID = Pattern.compile("\\bD\\d{3,8}\\b");
    private static final Pattern NUMERIC_DATE = Pattern.compile("\\b\\d{1,2}/\\d{1,2}/\\d{2,4}\\b");
    private static final Pattern ISO_DATE = Pattern.compile("\\b\\d{4}-\\d{1,2}-\\d{1,2}\\b");
    private static final Pattern SELF_INTRODUCED_NAME = Pattern.compile(
            "\\b(?i:my name is|i am|i'm|name\\s*:)\\s+([A-Z][a-z]{2,}\\s+[A-Z][a-z]{2,})\\b");
    private static final Pattern NAME_LIKE_PAIR = Pattern.compile("\\b[A-Z][a-z]{2,}\\s+[A-Z][a-z]{2,}\\b");

    private PiiRedactor() {}

    public static String redact(String text, Level level) {
        if (text == null || text.isEmpty() || level == Level.OFF) {
            return text;
        }
        List<String> protectedBlocks = new ArrayList<>();
        String working = protect(text, protectedBlocks);

        working = EMAIL.matcher(working).replaceAll("[REDACTED_EMAIL]");
        working = NUMERIC_DATE.matcher(working).replaceAll("[REDACTED_DATE]");
        working = ISO_DATE.matcher(working).replaceAll("[REDACTED_DATE]");
        working = DONOR_ID.matcher(working).replaceAll("[REDACTED_DONOR_ID]");
        working = replace(PHONE, working, m -> m.group().replaceAll("\\D", "").length() >= 8
                ? "[REDACTED_PHONE]" : m.group());
        working = replace(SELF_INTRODUCED_NAME, working, m -> m.group().replace(m.group(1), "[REDACTED_NAME]"));
        if (level == Level.STRICT) {
            working = NAME_LIKE_PAIR.matcher(working).replaceAll("[REDACTED_NAME]");
        }

        for (int i = 0; i < protectedBlocks.size(); i++) {
            working = working.replace(token(i), protectedBlocks.get(i));
        }
        return working;
    }

    private static String protect(String text, List<String> blocks) {
        return replace(BRACKETS, text, m -> {
            blocks.add(m.group());
            return token(blocks.size() - 1);
        });
    }

    private static String token(int index) {
        return "\u0000B" + index + "\u0000";
    }

    private static String replace(Pattern pattern, String text, Function<Matcher, String> fn) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(fn.apply(m)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
