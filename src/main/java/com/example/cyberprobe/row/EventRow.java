package com.example.cyberprobe.row;

import com.example.cyberprobe.schema.Column;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 一行待插入数据。key 只能是 {@link Column}，缺失的可选字段不写（不填 null）。
 */
@ToString
@EqualsAndHashCode
public class EventRow {

  private final Map<Column, RowValue> values = new LinkedHashMap<>();

  public EventRow put(Column column, RowValue value) {
    if (value != null) {
      values.put(column, value);
    }
    return this;
  }

  /** null 不写入。 */
  public EventRow putString(Column column, String value) {
    return value == null ? this : put(column, RowValue.of(value));
  }

  /** null 或空串不写入。 */
  public EventRow putNonEmpty(Column column, String value) {
    return value == null || value.isEmpty() ? this : put(column, RowValue.of(value));
  }

  public EventRow putInteger(Column column, Integer value) {
    return value == null ? this : put(column, RowValue.of(value.longValue()));
  }

  /** null 元素丢弃。 */
  public EventRow putStrings(Column column, List<String> value) {
    return value == null ? this : put(column, RowValue.of(value.stream().filter(Objects::nonNull).toList()));
  }

  public Optional<RowValue> get(Column column) {
    return Optional.ofNullable(values.get(column));
  }

  public boolean contains(Column column) {
    return values.containsKey(column);
  }

  public Set<Column> columns() {
    return Collections.unmodifiableSet(values.keySet());
  }

  public int size() {
    return values.size();
  }

  /** insertAll 的行内容：列名 -> JSON 值。 */
  public Map<String, Object> toContent() {
    Map<String, Object> content = new LinkedHashMap<>();
    values.forEach((c, v) -> content.put(c.columnName(), v.toJson()));
    return content;
  }
}
