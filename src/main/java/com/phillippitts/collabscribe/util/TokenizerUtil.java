package com.phillippitts.collabscribe.util;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Utility for splitting transcript text into words.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Split on runs of whitespace</li>
 *   <li>Leading and trailing whitespace produce no tokens</li>
 *   <li>Punctuation stays attached to its word</li>
 * </ul>
 */
public final class TokenizerUtil {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TokenizerUtil() {
        // Prevent instantiation
    }

    /**
     * Tokenizes text on whitespace.
     *
     * @param text input text (may be null or blank)
     * @return immutable list of tokens (empty if the text has none)
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(text.strip()));
    }

    /**
     * Counts whitespace-separated words.
     *
     * @param text input text (may be null or blank)
     * @return number of tokens
     */
    public static int countWords(String text) {
        return tokenize(text).size();
    }
}
