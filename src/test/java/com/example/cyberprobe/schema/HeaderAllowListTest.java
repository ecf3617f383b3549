package com.example.cyberprobe.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HeaderAllowListTest {

  @Test
  void testNormalize_StripsHyphensAndLowerCases() {
    assertThat(HeaderAllowList.normalize("X-Forwarded-For")).isEqualTo("xforwardedfor");
    assertThat(HeaderAllowList.normalize("WWW-Authenticate")).isEqualTo("wwwauthenticate");
    assertThat(HeaderAllowList.normalize("ETag")).isEqualTo("etag");
  }

  @Test
  void testNormalize_IsIdempotent() {
    String once = HeaderAllowList.normalize("Access-Control-Allow-Origin");

    assertThat(HeaderAllowList.normalize(once)).isEqualTo(once);
  }

  @Test
  void testColumnFor_AllowListed() {
    assertThat(HeaderAllowList.columnFor("User-Agent")).contains("useragent");
    assertThat(HeaderAllowList.columnFor("user-agent")).contains("useragent");
  }

  @Test
  void testColumnFor_NotAllowListed() {
    assertThat(HeaderAllowList.columnFor("X-Request-Id")).isEmpty();
    assertThat(HeaderAllowList.columnFor(null)).isEmpty();
  }

  @Test
  void testColumnFor_SpellingsThatOnlyNormalizeToAllowListed_AreRejected() {
    assertThat(HeaderAllowList.columnFor("XForwardedFor")).isEmpty();
    assertThat(HeaderAllowList.columnFor("AcceptCharset")).isEmpty();
    assertThat(HeaderAllowList.columnFor("Content-Type-")).isEmpty();
    assertThat(HeaderAllowList.columnFor("--Host")).isEmpty();
    assertThat(HeaderAllowList.columnFor("User--Agent")).isEmpty();
  }

  @Test
  void testColumnFor_DifferentCase_SameColumn() {
    assertThat(HeaderAllowList.columnFor("X-Forwarded-For")).contains("xforwardedfor");
    assertThat(HeaderAllowList.columnFor("x-forwarded-for")).contains("xforwardedfor");
    assertThat(HeaderAllowList.columnFor("ETAG")).contains("etag");
  }

  @Test
  void testColumns_OnePerHeader() {
    assertThat(HeaderAllowList.HEADERS).hasSize(28);
    assertThat(HeaderAllowList.columns()).hasSize(28).doesNotHaveDuplicates();
  }
}
