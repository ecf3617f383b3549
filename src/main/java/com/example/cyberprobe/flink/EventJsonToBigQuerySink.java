package com.example.cyberprobe.flink;

import com.example.cyberprobe.mapping.EventRowMapper;
import com.example.cyberprobe.model.Event;
import com.example.cyberprobe.sink.BigQueryInsertSink;
import com.example.cyberprobe.sink.LoaderJobConfig;
import com.example.cyberprobe.util.BigQueryClients;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.bigquery.BigQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.sink.RichSinkFunction;

import java.io.IOException;

@Slf4j
@RequiredArgsConstructor
public class EventJsonToBigQuerySink extends RichSinkFunction<String> {

  private final LoaderJobConfig config;

  private transient ObjectMapper objectMapper;
  private transient EventRowMapper mapper;
  private transient BigQueryInsertSink sink;

  @Override
  public void open(Configuration parameters) throws Exception {
    this.objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    this.mapper = new EventRowMapper();
    this.sink = new BigQueryInsertSink(createClient(), config.tableId(), config.getBatchSize());
  }

  protected BigQuery createClient() throws IOException {
    return BigQueryClients.open(config.getKeyFile(), config.getProject());
  }

  @Override
  public void invoke(String value, Context context) {
    if (value == null) {
      log.error("Null event payload dropped");
      return;
    }
    Event event;
    try {
      event = objectMapper.readValue(value, Event.class);
    } catch (JsonProcessingException e) {
      // 无法解析的消息直接丢弃
      log.error("Couldn't decode event JSON: {}", value, e);
      return;
    }
    if (event == null) {
      log.error("Empty event payload dropped");
      return;
    }
    sink.submit(mapper.map(event));
  }

  @Override
  public void close() throws Exception {
    if (sink != null && sink.pending() > 0) {
      log.info("Flushing {} buffered rows on close", sink.pending());
      sink.flush();
    }
    super.close();
  }
}
