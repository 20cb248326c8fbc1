package com.example.pipeline.supervisor;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code KEY=value} in process output; the value ends at whitespace, a quote or a backslash.
 * The key may follow a word boundary or a JSON string escape such as {@code \n}.
 */
final class ResultTokenExtractor {

  private final Pattern pattern;

  ResultTokenExtractor(String key) {
    this.pattern =
        Pattern.compile(
            "(?:(?<![A-Za-z0-9_])|(?<=\\\\[nrt]))"
                + Pattern.quote(key)
                + "=([^\\s\"\\\\]+)");
  }

  Optional<String> extract(CharSequence output) {
    final Matcher matcher = pattern.matcher(output);
    return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
  }
}
