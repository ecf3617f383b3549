package com.example.cyberprobe.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class LoaderPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
      .withUserConfiguration(LoaderProperties.class);

  @Test
  void testDefaults() {
    runner.run(context -> {
      LoaderProperties props = context.getBean(LoaderProperties.class);

      assertThat(props.getBigquery().getKey()).isEqualTo("private.json");
      assertThat(props.getBigquery().getProject()).isNull();
      assertThat(props.getBigquery().getDataset()).isEqualTo("cyberprobe");
      assertThat(props.getBigquery().getTable()).isEqualTo("cyberprobe");
      assertThat(props.getBigquery().getBatchSize()).isEqualTo(100);
      assertThat(props.getQueue().getBootstrapServers()).isEqualTo("localhost:9092");
      assertThat(props.getQueue().getGroupId()).isEqualTo("bigquery");
      assertThat(props.getCheckpoint().getIntervalMs()).isEqualTo(60000);
    });
  }

  @Test
  void testBinding_FromProperties() {
    runner
        .withPropertyValues(
            "loader.bigquery.key=/secrets/key.json",
            "loader.bigquery.project=my-project",
            "loader.bigquery.dataset=probe",
            "loader.bigquery.table=raw",
            "loader.bigquery.batch-size=500",
            "loader.queue.bootstrap-servers=kafka:9092",
            "loader.queue.group-id=loader")
        .run(context -> {
          LoaderProperties props = context.getBean(LoaderProperties.class);

          assertThat(props.getBigquery().getKey()).isEqualTo("/secrets/key.json");
          assertThat(props.getBigquery().getProject()).isEqualTo("my-project");
          assertThat(props.getBigquery().getDataset()).isEqualTo("probe");
          assertThat(props.getBigquery().getTable()).isEqualTo("raw");
          assertThat(props.getBigquery().getBatchSize()).isEqualTo(500);
          assertThat(props.getQueue().getBootstrapServers()).isEqualTo("kafka:9092");
          assertThat(props.getQueue().getGroupId()).isEqualTo("loader");
        });
  }
}
