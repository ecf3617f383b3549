package com.example.cyberprobe.util;

import com.example.cyberprobe.schema.EventTableSchema;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableInfo;
import lombok.extern.slf4j.Slf4j;

/**
 * 启动时检查目标表，不存在则按固定 schema 建表。
 * 查询失败（不论是否 404）一律尝试建表；建表失败向上抛出，启动中止。
 */
@Slf4j
public class BigQueryTableCreator {

  public static boolean createTableIfAbsent(BigQuery bigQuery, TableId tableId, String description) {

    if (existsTable(bigQuery, tableId)) {
      log.info("Table {} exists.", tableId.getTable());
      return false;
    }

    log.info("Table {} does not exist, creating...", tableId.getTable());

    TableInfo info = TableInfo.newBuilder(tableId, EventTableSchema.definition())
        .setDescription(description)
        .build();

    bigQuery.create(info);
    log.info("Table {} created.", tableId.getTable());
    return true;
  }

  private static boolean existsTable(BigQuery bigQuery, TableId tableId) {
    try {
      Table table = bigQuery.getTable(tableId);
      return table != null;
    } catch (BigQueryException e) {
      log.warn("Table lookup for {} failed: {}", tableId.getTable(), e.getMessage());
      return false;
    }
  }
}
