package com.example.pipeline.supervisor;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class OutputLineParserTest {

  private final OutputLineParser parser = new OutputLineParser(new ObjectMapper(), 20);

  @Test
  void nestedTextIsPreviewed() {
    assertThat(
            parser.preview(
                "{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"text\","
                    + "\"text\":\"Reading transcript\\nsecond line\"}]}}"))
        .isEqualTo("Reading transcript");
  }

  @Test
  void eventWithoutTextFallsBackToType() {
    assertThat(parser.preview("{\"type\":\"system\",\"session_id\":\"s1\"}"))
        .isEqualTo("[system]");
  }

  @Test
  void plainTextPassesThroughShortened() {
    assertThat(parser.preview("  plain progress output that is long  "))
        .isEqualTo("plain progress outpu...");
  }

  @Test
  void brokenJsonIsTreatedAsText() {
    assertThat(parser.preview("{not json")).isEqualTo("{not json");
  }
}
