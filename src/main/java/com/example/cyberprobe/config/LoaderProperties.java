package com.example.cyberprobe.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "loader")
public class LoaderProperties {

  // 目标端 BigQuery
  private BigQuery bigquery = new BigQuery();

  // 输入队列（Kafka）
  private Queue queue = new Queue();

  private Checkpoint checkpoint = new Checkpoint();

  @Data
  public static class BigQuery {
    private String key = "private.json";   // service account key file
    private String project;                // 必填
    private String dataset = "cyberprobe";
    private String table = "cyberprobe";
    private int batchSize = 100;           // flush when batch size > batchSize
    private String description = "cyberprobe event table";
  }

  @Data
  public static class Queue {
    private String bootstrapServers = "localhost:9092";
    private String groupId = "bigquery";
  }

  @Data
  public static class Checkpoint {
    private long intervalMs = 60000;
    private String storage = "file:///tmp/flink-checkpoints";
    private int retention = 2;
  }
}
