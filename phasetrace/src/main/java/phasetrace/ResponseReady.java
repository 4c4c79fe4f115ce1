/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.internal.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/** A response exists and response processing (filters, serialization) is about to run. */
public final class ResponseReady extends Checkpoint {
  public static final String STATUS_CODE = "http.status_code";
  public static final String CONTENT_TYPE = "http.content_type";
  public static final String CONTENT_LENGTH = "http.content_length";

  /** @param contentLength body size in bytes, or -1 when unknown */
  public static ResponseReady create(int statusCode, @Nullable String contentType,
    long contentLength) {
    return new ResponseReady(statusCode, contentType, contentLength);
  }

  final int statusCode;
  @Nullable final String contentType;
  final long contentLength;

  ResponseReady(int statusCode, @Nullable String contentType, long contentLength) {
    this.statusCode = statusCode;
    this.contentType = contentType;
    this.contentLength = contentLength;
  }

  @Override public Type type() {
    return Type.RESPONSE_READY;
  }

  public int statusCode() {
    return statusCode;
  }

  @Nullable public String contentType() {
    return contentType;
  }

  public long contentLength() {
    return contentLength;
  }

  @Override public Map<String, String> metadata() {
    Map<String, String> result = new LinkedHashMap<>();
    result.put(STATUS_CODE, String.valueOf(statusCode));
    result.put(CONTENT_TYPE, contentType != null ? contentType : "unknown");
    result.put(CONTENT_LENGTH, contentLength >= 0 ? String.valueOf(contentLength) : "unknown");
    return result;
  }
}
