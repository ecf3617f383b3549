package com.example.cyberprobe.flink;

import lombok.extern.slf4j.Slf4j;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.BasicTypeInfo;
import org.apache.flink.api.common.typeinfo.TypeInformation;

import java.nio.charset.StandardCharsets;

/**
 * Kafka record value -> UTF-8 字符串。value 为 null（tombstone）时返回 null，
 * 该记录被跳过，不会让 source 失败。
 */
@Slf4j
public class EventPayloadSchema implements DeserializationSchema<String> {
  private static final long serialVersionUID = 1L;

  @Override
  public String deserialize(byte[] message) {
    if (message == null) {
      log.warn("Dropping queue record with null payload");
      return null;
    }
    return new String(message, StandardCharsets.UTF_8);
  }

  @Override
  public boolean isEndOfStream(String nextElement) {
    return false;
  }

  @Override
  public TypeInformation<String> getProducedType() {
    return BasicTypeInfo.STRING_TYPE_INFO;
  }
}
