package com.example.cyberprobe.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueueArgumentsTest {

  private static QueueArguments parse(String... args) {
    return QueueArguments.parse(new DefaultApplicationArguments(args).getNonOptionArgs());
  }

  @Test
  void testInputOnly() {
    QueueArguments q = parse("cyberprobe");

    assertThat(q.input()).isEqualTo("cyberprobe");
    assertThat(q.outputs()).isEmpty();
  }

  @Test
  void testInputAndOutputs() {
    QueueArguments q = parse("withloc", "out1", "out2");

    assertThat(q.input()).isEqualTo("withloc");
    assertThat(q.outputs()).containsExactly("out1", "out2");
  }

  @Test
  void testSpringOptionArguments_AreSkipped() {
    QueueArguments q = parse("--logging.level.root=DEBUG", "withloc", "--spring.profiles.active=gcp");

    assertThat(q.input()).isEqualTo("withloc");
    assertThat(q.outputs()).isEmpty();
  }

  @Test
  void testMissingInput_ShouldFail() {
    assertThatThrownBy(() -> parse())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("input-queue");
    assertThatThrownBy(() -> parse("--foo=bar"))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> QueueArguments.parse(List.of()))
        .isInstanceOf(IllegalStateException.class);
  }
}
