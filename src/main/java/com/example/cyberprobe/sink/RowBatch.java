package com.example.cyberprobe.sink;

import com.example.cyberprobe.row.EventRow;

import java.util.ArrayList;
import java.util.List;

/**
 * 内存中的待插入行。只由 {@link BigQueryInsertSink} 持有，单线程使用，不持久化。
 */
public class RowBatch {

  private final List<EventRow> rows = new ArrayList<>();

  public void add(EventRow row) {
    rows.add(row);
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** 严格大于 threshold 才需要 flush。 */
  public boolean exceeds(int threshold) {
    return rows.size() > threshold;
  }

  public List<EventRow> rows() {
    return List.copyOf(rows);
  }

  public void clear() {
    rows.clear();
  }
}
