package com.polyspike.hft.polymarket.http;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

public final class HttpRequestFactory {

  private final URI baseUri;

  public HttpRequestFactory(URI baseUri) {
    this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
  }

  public HttpRequest.Builder request(String path, Map<String, String> query) {
    return HttpRequest.newBuilder(buildUri(path, query));
  }

  public static String pathSegment(String value) {
    return URLEncoder.encode(Objects.requireNonNull(value, "value"), StandardCharsets.UTF_8).replace("+", "%20");
  }

  URI buildUri(String path, Map<String, String> query) {
    StringBuilder sb = new StringBuilder(baseUri.toString());
    if (sb.length() > 0 && sb.charAt(sb.length() - 1) == '/' && path.startsWith("/")) {
      sb.setLength(sb.length() - 1);
    }
    sb.append(path);

    if (query != null && !query.isEmpty()) {
      sb.append('?');
      sb.append(query.entrySet().stream()
          .filter(e -> e.getValue() != null)
          .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
          .collect(Collectors.joining("&")));
    }
    return URI.create(sb.toString());
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
