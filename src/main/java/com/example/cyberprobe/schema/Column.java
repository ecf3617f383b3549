package com.example.cyberprobe.schema;

import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.Field.Mode;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.StandardSQLTypeName;

/**
 * 目标表的顶层列。行数据只能以这些列为 key。
 */
public enum Column {
  ID("id", StandardSQLTypeName.STRING, Mode.REQUIRED),
  TIME("time", StandardSQLTypeName.TIMESTAMP, Mode.REQUIRED),
  ACTION("action", StandardSQLTypeName.STRING, Mode.REQUIRED),
  DEVICE("device", StandardSQLTypeName.STRING, Mode.REQUIRED),
  UDP_SRC("udp_src", StandardSQLTypeName.INT64, Mode.NULLABLE),
  UDP_DEST("udp_dest", StandardSQLTypeName.INT64, Mode.NULLABLE),
  TCP_SRC("tcp_src", StandardSQLTypeName.INT64, Mode.NULLABLE),
  TCP_DEST("tcp_dest", StandardSQLTypeName.INT64, Mode.NULLABLE),
  IPV4_SRC("ipv4_src", StandardSQLTypeName.STRING, Mode.NULLABLE),
  IPV4_DEST("ipv4_dest", StandardSQLTypeName.STRING, Mode.NULLABLE),
  TYPE("type", StandardSQLTypeName.STRING, Mode.NULLABLE),
  QUERY("query", StandardSQLTypeName.STRING, Mode.REPEATED),
  ANSWER("answer", StandardSQLTypeName.STRUCT, Mode.REPEATED),
  METHOD("method", StandardSQLTypeName.STRING, Mode.NULLABLE),
  STATUS("status", StandardSQLTypeName.STRING, Mode.NULLABLE),
  CODE("code", StandardSQLTypeName.INT64, Mode.NULLABLE),
  SIZE("size", StandardSQLTypeName.INT64, Mode.NULLABLE),
  HEADER("header", StandardSQLTypeName.STRUCT, Mode.NULLABLE),
  URL("url", StandardSQLTypeName.STRING, Mode.NULLABLE),
  FROM("from", StandardSQLTypeName.STRING, Mode.NULLABLE),
  TO("to", StandardSQLTypeName.STRING, Mode.REPEATED),
  COMMAND("command", StandardSQLTypeName.STRING, Mode.NULLABLE),
  TEXT("text", StandardSQLTypeName.STRING, Mode.REPEATED);

  public static final String ANSWER_NAME = "name";
  public static final String ANSWER_ADDRESS = "address";

  private final String columnName;
  private final StandardSQLTypeName type;
  private final Mode mode;

  Column(String columnName, StandardSQLTypeName type, Mode mode) {
    this.columnName = columnName;
    this.type = type;
    this.mode = mode;
  }

  public String columnName() {
    return columnName;
  }

  public Field toField() {
    Field.Builder b;
    switch (this) {
      case ANSWER:
        b = Field.newBuilder(columnName, type, FieldList.of(
            nullableString(ANSWER_NAME),
            nullableString(ANSWER_ADDRESS)));
        break;
      case HEADER:
        b = Field.newBuilder(columnName, type, FieldList.of(
            HeaderAllowList.columns().stream().map(Column::nullableString).toList()));
        break;
      default:
        b = Field.newBuilder(columnName, type);
    }
    return b.setMode(mode).build();
  }

  private static Field nullableString(String name) {
    return Field.newBuilder(name, StandardSQLTypeName.STRING).setMode(Mode.NULLABLE).build();
  }
}
