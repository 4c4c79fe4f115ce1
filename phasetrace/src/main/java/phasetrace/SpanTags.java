/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.Span;
import java.util.Locale;
import java.util.Map;

final class SpanTags {
  static void tagAll(Span span, Map<String, String> tags) {
    for (Map.Entry<String, String> entry : tags.entrySet()) {
      span.tag(entry.getKey(), entry.getValue());
    }
  }

  /** Formats microseconds as milliseconds with microsecond precision. ex "12.345" */
  static String millis(long micros) {
    return String.format(Locale.ROOT, "%.3f", micros / 1000.0);
  }

  SpanTags() {
  }
}
