package com.example.cyberprobe.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一条 cyberprobe 事件（JSON）。只声明入库需要的字段，其余字段忽略。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Event {

  private String id;
  private String time;
  private String action;   // 见 EventAction
  private String device;
  private String url;

  private List<String> src;   // "ipv4:10.0.0.1", "tcp:443" ...
  private List<String> dest;

  @JsonProperty("http_request")
  private HttpRequest httpRequest;
  @JsonProperty("http_response")
  private HttpResponse httpResponse;
  @JsonProperty("ftp_command")
  private Command ftpCommand;
  @JsonProperty("ftp_response")
  private Response ftpResponse;
  @JsonProperty("dns_message")
  private DnsMessage dnsMessage;
  @JsonProperty("sip_request")
  private SipRequest sipRequest;
  @JsonProperty("sip_response")
  private SipResponse sipResponse;
  @JsonProperty("smtp_command")
  private Command smtpCommand;
  @JsonProperty("smtp_response")
  private Response smtpResponse;
  @JsonProperty("smtp_data")
  private SmtpData smtpData;

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class HttpRequest {
    private String method;
    private Map<String, String> header = new LinkedHashMap<>();
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class HttpResponse {
    private String status;
    private Integer code;
    private Map<String, String> header = new LinkedHashMap<>();
  }

  /** FTP / SMTP 命令。 */
  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Command {
    private String command;
  }

  /** FTP / SMTP response; status 可能是数字。 */
  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Response {
    private String status;
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> text;
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class DnsMessage {
    private String type;
    private List<String> query;
    private List<DnsAnswer> answer;
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class DnsAnswer {
    private String name;
    private String address;
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SipRequest {
    private String method;
    private String from;
    private String to;
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SipResponse {
    private Integer code;
    private String status;
    private String from;
    private String to;
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SmtpData {
    private String from;
    private List<String> to;
  }
}
