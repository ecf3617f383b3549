package com.example.cyberprobe.sink;

import com.example.cyberprobe.config.LoaderProperties;
import com.google.cloud.bigquery.TableId;
import lombok.Data;

import java.io.Serializable;
import java.util.Objects;

/**
 * 传给 Flink sink 的可序列化配置（LoaderProperties 是 Spring bean，不能直接下发）。
 */
@Data
public class LoaderJobConfig implements Serializable {
  private static final long serialVersionUID = 1L;

  private String keyFile;
  private String project;
  private String dataset;
  private String table;
  private int batchSize;

  public TableId tableId() {
    return TableId.of(project, dataset, table);
  }

  public static LoaderJobConfig from(LoaderProperties props) {
    LoaderProperties.BigQuery bq = props.getBigquery();
    if (bq.getProject() == null || bq.getProject().isBlank()) {
      throw new IllegalStateException("BIGQUERY_PROJECT (loader.bigquery.project) is required");
    }
    if (bq.getBatchSize() < 0) {
      throw new IllegalArgumentException("loader.bigquery.batch-size must not be negative: " + bq.getBatchSize());
    }
    LoaderJobConfig cfg = new LoaderJobConfig();
    cfg.keyFile = Objects.requireNonNull(bq.getKey(), "loader.bigquery.key required");
    cfg.project = bq.getProject();
    cfg.dataset = Objects.requireNonNull(bq.getDataset(), "loader.bigquery.dataset required");
    cfg.table = Objects.requireNonNull(bq.getTable(), "loader.bigquery.table required");
    cfg.batchSize = bq.getBatchSize();
    return cfg;
  }
}
