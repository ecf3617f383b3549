package com.example.cyberprobe.schema;

import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.TableDefinition;
import com.google.cloud.bigquery.TimePartitioning;

import java.util.Arrays;
import java.util.List;

/** cyberprobe 事件表的 BigQuery schema。 */
public final class EventTableSchema {

  private EventTableSchema() {}

  public static List<Field> fields() {
    return Arrays.stream(Column.values()).map(Column::toField).toList();
  }

  public static Schema schema() {
    return Schema.of(fields());
  }

  /** 按天分区。 */
  public static TableDefinition definition() {
    return StandardTableDefinition.newBuilder()
        .setSchema(schema())
        .setTimePartitioning(TimePartitioning.of(TimePartitioning.Type.DAY))
        .build();
  }
}
