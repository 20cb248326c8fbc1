package com.example.pipeline.supervisor;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LineAssemblerTest {

  @Test
  void joinsLinesSplitAcrossChunks() {
    final LineAssembler assembler = new LineAssembler();

    assertThat(assembler.append("{\"type\":\"ass")).isEmpty();
    assertThat(assembler.append("istant\"}\nsecond")).containsExactly("{\"type\":\"assistant\"}");
    assertThat(assembler.append(" line\r\nthird")).containsExactly("second line");
    assertThat(assembler.flush()).contains("third");
    assertThat(assembler.flush()).isEmpty();
  }

  @Test
  void keepsEmptyLines() {
    final LineAssembler assembler = new LineAssembler();

    assertThat(assembler.append("a\n\nb\n")).containsExactly("a", "", "b");
    assertThat(assembler.flush()).isEmpty();
  }
}
