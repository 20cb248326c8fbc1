/*
 * Where: pipeline subprocess supervisor
 * What: turns one output line into a short preview for progress logs
 * Why: the agent emits JSON events mixed with plain text; neither may break the reader
 */
package com.example.pipeline.supervisor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;

final class OutputLineParser {

  private static final List<String> TEXT_FIELDS = List.of("text", "content", "result", "message");
  private static final int MAX_DEPTH = 6;

  private final ObjectMapper objectMapper;
  private final int maxLength;

  OutputLineParser(ObjectMapper objectMapper, int maxLength) {
    this.objectMapper = objectMapper;
    this.maxLength = maxLength;
  }

  String preview(String line) {
    final String trimmed = line.strip();
    if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
      try {
        final JsonNode node = objectMapper.readTree(trimmed);
        final Optional<String> text = findText(node, 0);
        if (text.isPresent()) {
          return shorten(firstLine(text.get()));
        }
        final JsonNode type = node.get("type");
        return shorten(type != null && type.isTextual() ? "[" + type.asText() + "]" : trimmed);
      } catch (JsonProcessingException ignored) {
        // not JSON after all; fall through to plain text
      }
    }
    return shorten(trimmed);
  }

  private Optional<String> findText(JsonNode node, int depth) {
    if (node == null || depth > MAX_DEPTH) {
      return Optional.empty();
    }
    if (node.isArray()) {
      for (JsonNode element : node) {
        final Optional<String> found = findText(element, depth + 1);
        if (found.isPresent()) {
          return found;
        }
      }
      return Optional.empty();
    }
    if (!node.isObject()) {
      return Optional.empty();
    }
    for (String field : TEXT_FIELDS) {
      final JsonNode value = node.get(field);
      if (value != null && value.isTextual() && !value.asText().isBlank()) {
        return Optional.of(value.asText());
      }
    }
    for (String field : TEXT_FIELDS) {
      final Optional<String> nested = findText(node.get(field), depth + 1);
      if (nested.isPresent()) {
        return nested;
      }
    }
    return Optional.empty();
  }

  private String firstLine(String text) {
    final String stripped = text.strip();
    final int newline = stripped.indexOf('\n');
    return newline < 0 ? stripped : stripped.substring(0, newline).strip();
  }

  private String shorten(String text) {
    return text.length() <= maxLength ? text : text.substring(0, maxLength) + "...";
  }
}
