package com.example.cyberprobe.flink;

import com.example.cyberprobe.config.LoaderProperties;
import com.example.cyberprobe.config.QueueArguments;
import com.example.cyberprobe.sink.LoaderJobConfig;
import com.example.cyberprobe.util.BigQueryClients;
import com.example.cyberprobe.util.BigQueryTableCreator;
import com.google.cloud.bigquery.BigQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStreamSource;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class FlinkLoaderRunner implements ApplicationRunner {

  private final LoaderProperties props;

  @Override
  public void run(ApplicationArguments args) throws Exception {
    QueueArguments queues = QueueArguments.parse(args.getNonOptionArgs());
    if (!queues.outputs().isEmpty()) {
      log.info("Output queues {} ignored, this loader is a terminal sink.", queues.outputs());
    }

    LoaderJobConfig cfg = LoaderJobConfig.from(props);

    log.info("Initialising...");

    // 启动前确保目标表存在；失败直接抛出，不消费任何消息
    BigQuery bigQuery = BigQueryClients.open(cfg.getKeyFile(), cfg.getProject());
    log.info("Connected.");
    BigQueryTableCreator.createTableIfAbsent(bigQuery, cfg.tableId(), props.getBigquery().getDescription());

    // Flink 环境
    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
    env.enableCheckpointing(props.getCheckpoint().getIntervalMs(), CheckpointingMode.AT_LEAST_ONCE);
    env.getCheckpointConfig().setCheckpointStorage(props.getCheckpoint().getStorage());
    env.getCheckpointConfig().setTolerableCheckpointFailureNumber(props.getCheckpoint().getRetention());

    KafkaSource<String> source = KafkaSource.<String>builder()
        .setBootstrapServers(props.getQueue().getBootstrapServers())
        .setTopics(queues.input())
        .setGroupId(props.getQueue().getGroupId())
        .setStartingOffsets(OffsetsInitializer.committedOffsets(OffsetResetStrategy.EARLIEST))
        .setValueOnlyDeserializer(new EventPayloadSchema())
        .build();

    DataStreamSource<String> stream =
        env.fromSource(source, WatermarkStrategy.noWatermarks(), "queue-" + queues.input());

    // 单实例 sink：批次只由一个线程持有
    stream.addSink(new EventJsonToBigQuerySink(cfg))
        .name("bigquery-insert")
        .setParallelism(1);

    log.info("Initialisation complete, consuming from {}.", queues.input());
    env.execute("Queue -> BigQuery " + cfg.getDataset() + "." + cfg.getTable());
  }
}
