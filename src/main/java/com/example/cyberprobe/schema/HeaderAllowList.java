package com.example.cyberprobe.schema;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 入库保留的 HTTP 头白名单。修改时 header 子字段的 schema 会随之变化。
 */
public final class HeaderAllowList {

  public static final List<String> HEADERS = List.of(
      "Accept",
      "Accept-Charset",
      "Accept-Language",
      "Access-Control-Allow-Origin",
      "Authorization",
      "Connection",
      "Content-Encoding",
      "Content-Language",
      "Content-Location",
      "Content-Type",
      "Cookie",
      "Date",
      "ETag",
      "Forwarded",
      "Host",
      "Link",
      "Location",
      "Origin",
      "Proxy-Authorization",
      "Referer",
      "Server",
      "Set-Cookie",
      "Upgrade",
      "User-Agent",
      "Via",
      "WWW-Authenticate",
      "X-Forwarded-For",
      "X-Forwarded-Host"
  );

  // header name (大小写不敏感) -> normalized name
  private static final Map<String, String> BY_NAME;

  static {
    Map<String, String> m = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (String h : HEADERS) {
      m.put(h, normalize(h));
    }
    BY_NAME = Collections.unmodifiableMap(m);
  }

  private HeaderAllowList() {}

  /** "X-Forwarded-For" -> "xforwardedfor" */
  public static String normalize(String header) {
    return header.replace("-", "").toLowerCase(Locale.ROOT);
  }

  /**
   * 按原始 header 名（大小写不敏感）匹配白名单，命中后才规范化。
   * "XForwardedFor"、"Content-Type-" 之类不在白名单内。
   */
  public static Optional<String> columnFor(String header) {
    if (header == null) return Optional.empty();
    return Optional.ofNullable(BY_NAME.get(header));
  }

  /** 按声明顺序的列名。 */
  public static List<String> columns() {
    return HEADERS.stream().map(HeaderAllowList::normalize).toList();
  }
}
