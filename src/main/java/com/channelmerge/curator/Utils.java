package com.channelmerge.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Utility class for helper methods shared by export, probing and sink code.
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/\\\\:\\s]", "_");
    }

    /**
     * Runs an action up to maxAttempts times with exponential backoff between attempts.
     * @param action Callable action to execute
     * @param maxAttempts Maximum number of attempts (at least 1)
     * @param initialBackoffMillis Delay before the second attempt; doubled for each further attempt
     * @param actionDesc Description for logging
     * @param <T> Return type
     * @return Result of the first successful attempt
     * @throws Exception the failure of the last attempt, or InterruptedException if the backoff was interrupted
     */
    public static <T> T retry(Callable<T> action, int maxAttempts, long initialBackoffMillis, String actionDesc) throws Exception {
        int attempts = Math.max(1, maxAttempts);
        Exception last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return action.call();
            } catch (Exception e) {
                last = e;
                logger.warn("Failed {} (attempt {}/{}): {}", actionDesc, attempt, attempts, e.getMessage());
                if (attempt < attempts && initialBackoffMillis > 0) {
                    Thread.sleep(initialBackoffMillis << (attempt - 1));
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, attempts);
        throw last;
    }

    /**
     * Extracts the authority host of an endpoint URL without full URI parsing, which many stream URLs fail.
     * Userinfo and port are removed; a bracketed IPv6 literal keeps its brackets.
     * @param endpoint URL string
     * @return lower-cased host, or empty string if the URL has no {@code scheme://} prefix
     */
    public static String hostOf(String endpoint) {
        if (endpoint == null) return "";
        int schemeEnd = endpoint.indexOf("://");
        if (schemeEnd < 0) return "";
        int start = schemeEnd + 3;
        int end = start;
        while (end < endpoint.length() && "/?#".indexOf(endpoint.charAt(end)) < 0) end++;
        String authority = endpoint.substring(start, end);
        int at = authority.lastIndexOf('@');
        if (at >= 0) authority = authority.substring(at + 1);
        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            return (close > 0 ? authority.substring(0, close + 1) : authority).toLowerCase(Locale.ROOT);
        }
        int colon = authority.indexOf(':');
        return (colon >= 0 ? authority.substring(0, colon) : authority).toLowerCase(Locale.ROOT);
    }
}
