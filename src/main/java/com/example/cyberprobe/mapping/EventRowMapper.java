package com.example.cyberprobe.mapping;

import com.example.cyberprobe.model.Event;
import com.example.cyberprobe.model.EventAction;
import com.example.cyberprobe.row.EventRow;
import com.example.cyberprobe.row.RowValue;
import com.example.cyberprobe.row.RowValue.RecordListValue;
import com.example.cyberprobe.row.RowValue.RecordValue;
import com.example.cyberprobe.schema.Column;
import com.example.cyberprobe.schema.HeaderAllowList;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 把一条事件转换为一行表数据。无副作用，只读事件本身和 header 白名单。
 */
@Slf4j
public class EventRowMapper {

  public EventRow map(Event e) {
    EventRow row = new EventRow();

    row.putNonEmpty(Column.ID, e.getId());
    row.putNonEmpty(Column.ACTION, e.getAction());
    row.putNonEmpty(Column.DEVICE, e.getDevice());
    row.putNonEmpty(Column.TIME, e.getTime());

    EventAction action = EventAction.of(e.getAction());

    switch (action) {
      case HTTP_REQUEST: {
        Event.HttpRequest req = e.getHttpRequest();
        if (req != null) {
          row.putString(Column.METHOD, req.getMethod());
        }
        row.put(Column.HEADER, new RecordValue(headers(req == null ? null : req.getHeader())));
        break;
      }
      case HTTP_RESPONSE: {
        Event.HttpResponse resp = e.getHttpResponse();
        if (resp != null) {
          row.putString(Column.STATUS, resp.getStatus());
          row.putInteger(Column.CODE, resp.getCode());
        }
        row.put(Column.HEADER, new RecordValue(headers(resp == null ? null : resp.getHeader())));
        break;
      }
      case FTP_COMMAND:
        command(row, e.getFtpCommand());
        break;
      case FTP_RESPONSE:
        response(row, e.getFtpResponse());
        break;
      case DNS_MESSAGE:
        dns(row, e.getDnsMessage());
        break;
      case SIP_REQUEST: {
        Event.SipRequest req = e.getSipRequest();
        if (req != null) {
          row.putString(Column.METHOD, req.getMethod());
          row.putString(Column.FROM, req.getFrom());
          if (req.getTo() != null) row.putStrings(Column.TO, List.of(req.getTo()));
        }
        break;
      }
      case SIP_RESPONSE: {
        Event.SipResponse resp = e.getSipResponse();
        if (resp != null) {
          row.putInteger(Column.CODE, resp.getCode());
          row.putString(Column.STATUS, resp.getStatus());
          row.putString(Column.FROM, resp.getFrom());
          if (resp.getTo() != null) row.putStrings(Column.TO, List.of(resp.getTo()));
        }
        break;
      }
      case SMTP_COMMAND:
        command(row, e.getSmtpCommand());
        break;
      case SMTP_RESPONSE:
        response(row, e.getSmtpResponse());
        break;
      case SMTP_DATA: {
        Event.SmtpData data = e.getSmtpData();
        if (data != null) {
          row.putString(Column.FROM, data.getFrom());
          row.putStrings(Column.TO, data.getTo());
        }
        break;
      }
      case ICMP:
      case NTP_TIMESTAMP:
      case NTP_CONTROL:
      case NTP_PRIVATE:
        break;
      default:
        log.debug("No field mapping for action '{}', event {}", e.getAction(), e.getId());
    }

    row.putNonEmpty(Column.URL, e.getUrl());

    addresses(row, e.getSrc(), Column.IPV4_SRC, Column.TCP_SRC, Column.UDP_SRC);
    addresses(row, e.getDest(), Column.IPV4_DEST, Column.TCP_DEST, Column.UDP_DEST);

    return row;
  }

  /** 白名单过滤 + 规范化；同名后者覆盖前者。 */
  static Map<String, String> headers(Map<String, String> raw) {
    Map<String, String> h = new LinkedHashMap<>();
    if (raw == null) return h;
    for (Map.Entry<String, String> en : raw.entrySet()) {
      Optional<String> col = HeaderAllowList.columnFor(en.getKey());
      col.ifPresent(c -> h.put(c, en.getValue()));
    }
    return h;
  }

  private void command(EventRow row, Event.Command cmd) {
    if (cmd != null) {
      row.putString(Column.COMMAND, cmd.getCommand());
    }
  }

  private void response(EventRow row, Event.Response resp) {
    if (resp != null) {
      row.putString(Column.STATUS, resp.getStatus());
      row.putStrings(Column.TEXT, resp.getText());
    }
  }

  private void dns(EventRow row, Event.DnsMessage dns) {
    if (dns == null) return;
    if (dns.getQuery() != null && !dns.getQuery().isEmpty()) {
      row.putStrings(Column.QUERY, dns.getQuery());
    }
    if (dns.getAnswer() != null && !dns.getAnswer().isEmpty()) {
      List<RecordValue> answers = dns.getAnswer().stream()
          .filter(a -> a != null)
          .map(a -> {
            Map<String, String> m = new LinkedHashMap<>();
            m.put(Column.ANSWER_NAME, a.getName());
            m.put(Column.ANSWER_ADDRESS, a.getAddress());
            return new RecordValue(m);
          })
          .toList();
      row.put(Column.ANSWER, new RecordListValue(answers));
    }
    row.putString(Column.TYPE, dns.getType());
  }

  /**
   * "class:address" 列表。ipv4 原样写入；tcp/udp 端口解析为整数，解析失败则跳过。
   * 未知 class 忽略，同一 class 多次出现时最后一个生效。
   */
  private void addresses(EventRow row, List<String> list, Column ipv4, Column tcp, Column udp) {
    if (list == null) return;
    for (String v : list) {
      if (v == null) continue;
      int idx = v.indexOf(':');
      String cls = idx < 0 ? v : v.substring(0, idx);
      String addr = idx < 0 ? "" : v.substring(idx + 1);

      switch (cls) {
        case "ipv4":
          row.putString(ipv4, addr);
          break;
        case "tcp":
          port(row, tcp, addr);
          break;
        case "udp":
          port(row, udp, addr);
          break;
        default:
          // mac, ipv6 ... 表中无对应列
      }
    }
  }

  private void port(EventRow row, Column column, String addr) {
    try {
      row.put(column, RowValue.of(Long.parseLong(addr)));
    } catch (NumberFormatException ex) {
      log.warn("Ignoring non-numeric {} value: '{}'", column.columnName(), addr);
    }
  }
}
