package com.example.cyberprobe.model;

import java.util.HashMap;
import java.util.Map;

public enum EventAction {
  HTTP_REQUEST("http_request"),
  HTTP_RESPONSE("http_response"),
  FTP_COMMAND("ftp_command"),
  FTP_RESPONSE("ftp_response"),
  ICMP("icmp"),
  DNS_MESSAGE("dns_message"),
  SIP_REQUEST("sip_request"),
  SIP_RESPONSE("sip_response"),
  SMTP_COMMAND("smtp_command"),
  SMTP_RESPONSE("smtp_response"),
  SMTP_DATA("smtp_data"),
  NTP_TIMESTAMP("ntp_timestamp"),
  NTP_CONTROL("ntp_control"),
  NTP_PRIVATE("ntp_private"),
  UNKNOWN(null);

  private static final Map<String, EventAction> BY_VALUE = new HashMap<>();

  static {
    for (EventAction a : values()) {
      if (a.value != null) BY_VALUE.put(a.value, a);
    }
  }

  private final String value;

  EventAction(String value) {
    this.value = value;
  }

  /** 未知或空的 action 返回 UNKNOWN，从不抛异常。 */
  public static EventAction of(String value) {
    if (value == null) return UNKNOWN;
    return BY_VALUE.getOrDefault(value, UNKNOWN);
  }
}
