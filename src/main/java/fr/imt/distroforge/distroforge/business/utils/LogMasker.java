package fr.imt.distroforge.distroforge.business.utils;

import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.regex.Pattern;

@UtilityClass
public class LogMasker {

    private static final String REDACTED = "[REDACTED]";

    private static final List<Pattern> SENSITIVE_PATTERNS = List.of(
            Pattern.compile("dckr_pat_[A-Za-z0-9_-]+"),
            Pattern.compile("ghp_[A-Za-z0-9]+"),
            Pattern.compile("(?i)password[=:]\\s*\\S+"),
            Pattern.compile("(?i)token[=:]\\s*\\S+")
    );

    /**
     * Replace registry tokens and credentials so they never reach build logs.
     */
    public static String mask(String text) {
        if (text == null) {
            return "";
        }
        String masked = text;
        for (Pattern pattern : SENSITIVE_PATTERNS) {
            masked = pattern.matcher(masked).replaceAll(REDACTED);
        }
        return masked;
    }
}
