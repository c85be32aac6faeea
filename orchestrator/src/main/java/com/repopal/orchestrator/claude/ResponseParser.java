package com.repopal.orchestrator.claude;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the answer from Claude's text responses.
 *
 * Prompts ask for the answer inside {@code <result>...</result>}; models sometimes
 * wrap JSON in a fenced block instead, so that is accepted too.
 */
public final class ResponseParser {

    private static final Pattern RESULT_TAG = Pattern.compile("<result>(.*?)</result>", Pattern.DOTALL);

    // ```json ... ``` or ``` ... ```
    private static final Pattern JSON_BLOCK = Pattern.compile("```(?:json)?\\s*\\n(.*?)\\n```", Pattern.DOTALL);

    private ResponseParser() {}

    /** Content of the first {@code <result>} tag. */
    public static Optional<String> extractResult(String response) {
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /** The {@code <result>} content, else the first fenced block. */
    public static Optional<String> extractJson(String response) {
        Optional<String> tagged = extractResult(response);
        if (tagged.isPresent()) return tagged;
        Matcher m = JSON_BLOCK.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }
}
