package io.github.drompincen.clawrelay.runtime.auth;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class AuthOutputScanner {

    private static final Pattern ANSI = Pattern.compile("\u001B\\[[0-?]*[ -/]*[@-~]");
    private static final Pattern URL = Pattern.compile("https?://[^\\s'\")\\]]+");

    private AuthOutputScanner() {}

    static String stripAnsi(String text) {
        return ANSI.matcher(text).replaceAll("");
    }

    static String extractUrl(String text) {
        Matcher m = URL.matcher(text);
        return m.find() ? m.group() : null;
    }

    static boolean containsAny(String text, List<String> phrases) {
        return phrases.stream().anyMatch(text::contains);
    }

    static boolean containsAnyIgnoreCase(String text, List<String> phrases) {
        String normalized = text.toLowerCase(Locale.ROOT);
        return phrases.stream().anyMatch(p -> normalized.contains(p.toLowerCase(Locale.ROOT)));
    }

    static String tail(CharSequence text, int max) {
        return text.length() <= max ? text.toString() : text.subSequence(text.length() - max, text.length()).toString();
    }
}
