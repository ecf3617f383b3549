package com.example.cyberprobe.config;

import java.util.List;

/**
 * 位置参数：输入队列 + 零个或多个输出队列。
 * 输出队列仅为与其它 pipeline 阶段保持一致而接受，本程序不写任何输出队列。
 */
public record QueueArguments(String input, List<String> outputs) {

  /** nonOptionArgs 来自 ApplicationArguments，--name=value 已被 Spring 剔除。 */
  public static QueueArguments parse(List<String> nonOptionArgs) {
    if (nonOptionArgs == null || nonOptionArgs.isEmpty()) {
      throw new IllegalStateException("Usage: <input-queue> [<output-queue> ...]");
    }
    return new QueueArguments(nonOptionArgs.get(0), List.copyOf(nonOptionArgs.subList(1, nonOptionArgs.size())));
  }
}
