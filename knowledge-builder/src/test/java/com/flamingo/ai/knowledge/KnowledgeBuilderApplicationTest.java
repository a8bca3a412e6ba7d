package com.flamingo.ai.knowledge;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("KnowledgeBuilderApplication Tests")
class KnowledgeBuilderApplicationTest {

  @Test
  @DisplayName("should drop Spring property arguments before command parsing")
  void shouldDropPropertyArguments() {
    String[] args = {
      "--knowledge.chunking.max-chars=2000",
      "build-knowledge",
      "a.docx",
      "a",
      "--logging.level.root=DEBUG",
      "b.docx",
      "b",
      "out.json"
    };

    assertThat(KnowledgeBuilderApplication.commandArguments(args))
        .containsExactly("build-knowledge", "a.docx", "a", "b.docx", "b", "out.json");
  }

  @Test
  @DisplayName("should keep command options and positional arguments")
  void shouldKeepCommandArguments() {
    String[] args = {"docx-to-text", "--help", "in.dir", "out.dir"};

    assertThat(KnowledgeBuilderApplication.commandArguments(args)).containsExactly(args);
  }
}
