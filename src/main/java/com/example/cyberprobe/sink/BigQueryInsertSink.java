package com.example.cyberprobe.sink;

import com.example.cyberprobe.row.EventRow;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.InsertAllResponse;
import com.google.cloud.bigquery.TableId;
import lombok.extern.slf4j.Slf4j;

/**
 * 攒批写入 BigQuery。批量超过阈值时一次 insertAll 整批提交，
 * 无论成功与否都清空批次；失败只记日志，不重试。
 */
@Slf4j
public class BigQueryInsertSink {

  private final BigQuery bigQuery;
  private final TableId tableId;
  private final int batchSize;

  private final RowBatch batch = new RowBatch();

  public BigQueryInsertSink(BigQuery bigQuery, TableId tableId, int batchSize) {
    this.bigQuery = bigQuery;
    this.tableId = tableId;
    this.batchSize = batchSize;
  }

  public void submit(EventRow row) {
    batch.add(row);
    if (batch.exceeds(batchSize)) {
      flush();
    }
  }

  public void flush() {
    if (batch.isEmpty()) return;

    InsertAllRequest.Builder req = InsertAllRequest.newBuilder(tableId);
    for (EventRow r : batch.rows()) {
      req.addRow(r.toContent());
    }
    int n = batch.size();

    try {
      InsertAllResponse resp = bigQuery.insertAll(req.build());
      if (resp != null && resp.hasErrors()) {
        log.warn("InsertAll: {} of {} rows rejected by {}", resp.getInsertErrors().size(), n, tableId.getTable());
      } else {
        log.debug("InsertAll: {} rows into {}", n, tableId.getTable());
      }
    } catch (RuntimeException e) {
      log.error("InsertAll: {} rows discarded: {}", n, e.getMessage(), e);
    } finally {
      batch.clear();
    }
  }

  public int pending() {
    return batch.size();
  }
}
