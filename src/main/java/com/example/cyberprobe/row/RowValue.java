package com.example.cyberprobe.row;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 行中的一个值。只有下列几种，与表 schema 一一对应：
 * STRING / INTEGER / REPEATED STRING / RECORD / REPEATED RECORD。
 */
public interface RowValue {

  /** insertAll 所需的 JSON 形式。 */
  Object toJson();

  static RowValue of(String v) {
    return new StringValue(v);
  }

  static RowValue of(long v) {
    return new IntegerValue(v);
  }

  static RowValue of(List<String> v) {
    return new StringListValue(v);
  }

  record StringValue(String value) implements RowValue {
    @Override
    public Object toJson() {
      return value;
    }
  }

  record IntegerValue(long value) implements RowValue {
    @Override
    public Object toJson() {
      return value;
    }
  }

  record StringListValue(List<String> values) implements RowValue {
    public StringListValue {
      values = List.copyOf(values);
    }

    @Override
    public Object toJson() {
      return values;
    }
  }

  record RecordValue(Map<String, String> fields) implements RowValue {
    public RecordValue {
      Map<String, String> m = new LinkedHashMap<>();
      fields.forEach((k, v) -> {
        if (v != null) m.put(k, v);
      });
      fields = Collections.unmodifiableMap(m);
    }

    @Override
    public Object toJson() {
      return new LinkedHashMap<String, Object>(fields);
    }
  }

  record RecordListValue(List<RecordValue> records) implements RowValue {
    public RecordListValue {
      records = List.copyOf(records);
    }

    @Override
    public Object toJson() {
      return records.stream().map(RecordValue::toJson).toList();
    }
  }
}
