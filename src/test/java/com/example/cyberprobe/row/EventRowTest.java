package com.example.cyberprobe.row;

import com.example.cyberprobe.model.EventAction;
import com.example.cyberprobe.schema.Column;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EventRowTest {

  @Test
  void testNullAndEmptyValues_AreOmitted() {
    EventRow row = new EventRow()
        .putNonEmpty(Column.ID, "")
        .putNonEmpty(Column.DEVICE, null)
        .putString(Column.METHOD, null)
        .putInteger(Column.CODE, null)
        .putStrings(Column.TO, null);

    assertThat(row.size()).isZero();
    assertThat(row.toContent()).isEmpty();
  }

  @Test
  void testPutStrings_DropsNullElements() {
    EventRow row = new EventRow().putStrings(Column.TO, Arrays.asList("a", null, "b"));

    assertThat(row.toContent()).isEqualTo(Map.of("to", List.of("a", "b")));
  }

  @Test
  void testToContent_UsesColumnNames() {
    EventRow row = new EventRow()
        .putNonEmpty(Column.IPV4_SRC, "10.0.0.1")
        .put(Column.TCP_SRC, RowValue.of(443L))
        .put(Column.HEADER, new RowValue.RecordValue(Map.of("host", "example.com")));

    assertThat(row.toContent())
        .containsEntry("ipv4_src", "10.0.0.1")
        .containsEntry("tcp_src", 443L)
        .containsEntry("header", Map.of("host", "example.com"));
  }

  @Test
  void testEventAction_Lookup() {
    assertThat(EventAction.of("dns_message")).isEqualTo(EventAction.DNS_MESSAGE);
    assertThat(EventAction.of("ntp_private")).isEqualTo(EventAction.NTP_PRIVATE);
    assertThat(EventAction.of("")).isEqualTo(EventAction.UNKNOWN);
    assertThat(EventAction.of(null)).isEqualTo(EventAction.UNKNOWN);
    assertThat(EventAction.of("HTTP_REQUEST")).isEqualTo(EventAction.UNKNOWN);
  }
}
