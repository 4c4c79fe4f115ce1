/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.internal.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/** The request entered the pipeline. */
public final class RequestStart extends Checkpoint {
  public static final String URL = "http.url";
  public static final String METHOD = "http.method";
  public static final String CLIENT_IP = "client.ip";
  public static final String USER_AGENT = "http.user_agent";

  public static RequestStart create(String uri, String method, @Nullable String clientIp,
    @Nullable String userAgent) {
    if (uri == null) throw new NullPointerException("uri == null");
    if (method == null) throw new NullPointerException("method == null");
    return new RequestStart(uri, method, clientIp, userAgent);
  }

  final String uri, method;
  @Nullable final String clientIp, userAgent;

  RequestStart(String uri, String method, @Nullable String clientIp, @Nullable String userAgent) {
    this.uri = uri;
    this.method = method;
    this.clientIp = clientIp;
    this.userAgent = userAgent;
  }

  @Override public Type type() {
    return Type.REQUEST_START;
  }

  public String uri() {
    return uri;
  }

  public String method() {
    return method;
  }

  @Nullable public String clientIp() {
    return clientIp;
  }

  @Nullable public String userAgent() {
    return userAgent;
  }

  @Override public Map<String, String> metadata() {
    Map<String, String> result = new LinkedHashMap<>();
    result.put(URL, uri);
    result.put(METHOD, method);
    result.put(CLIENT_IP, clientIp != null ? clientIp : "unknown");
    result.put(USER_AGENT, userAgent != null ? userAgent : "unknown");
    return result;
  }
}
