package com.example.pipeline.supervisor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Splits a chunked character stream into complete lines, holding back the trailing partial. */
final class LineAssembler {

  private final StringBuilder pending = new StringBuilder();

  List<String> append(CharSequence chunk) {
    final List<String> lines = new ArrayList<>();
    for (int i = 0; i < chunk.length(); i++) {
      final char c = chunk.charAt(i);
      if (c == '\n') {
        lines.add(stripCarriageReturn(pending.toString()));
        pending.setLength(0);
      } else {
        pending.append(c);
      }
    }
    return lines;
  }

  /** Returns the unterminated last line, if any; called once the stream has ended. */
  Optional<String> flush() {
    if (pending.length() == 0) {
      return Optional.empty();
    }
    final String line = stripCarriageReturn(pending.toString());
    pending.setLength(0);
    return Optional.of(line);
  }

  private String stripCarriageReturn(String line) {
    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }
}
