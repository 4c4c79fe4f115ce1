/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.internal.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** An instruction that an operation should be measured as its own span. */
public final class TraceIntent {
  /** Traces the operation with default name and description, and no extra tags. */
  public static final TraceIntent DEFAULT = newBuilder().build();

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Converts an annotation, treating empty strings as unset.
   *
   * @throws IllegalArgumentException if a tag isn't in {@code key=value} form
   */
  public static TraceIntent from(Traced traced) {
    if (traced == null) throw new NullPointerException("traced == null");
    Builder builder = newBuilder()
      .operationName(traced.operationName())
      .description(traced.description());
    for (String tag : traced.tags()) {
      int eq = tag.indexOf('=');
      if (eq <= 0) throw new IllegalArgumentException("tag should be key=value: " + tag);
      builder.tag(tag.substring(0, eq).trim(), tag.substring(eq + 1).trim());
    }
    return builder.build();
  }

  @Nullable final String operationName, description;
  final Map<String, String> tags;

  TraceIntent(Builder builder) {
    this.operationName = builder.operationName;
    this.description = builder.description;
    this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
  }

  @Nullable public String operationName() {
    return operationName;
  }

  @Nullable public String description() {
    return description;
  }

  public Map<String, String> tags() {
    return tags;
  }

  public Builder toBuilder() {
    Builder result = new Builder();
    result.operationName = operationName;
    result.description = description;
    result.tags.putAll(tags);
    return result;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceIntent)) return false;
    TraceIntent that = (TraceIntent) o;
    return equal(operationName, that.operationName)
      && equal(description, that.description)
      && tags.equals(that.tags);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= operationName == null ? 0 : operationName.hashCode();
    h *= 1000003;
    h ^= description == null ? 0 : description.hashCode();
    h *= 1000003;
    h ^= tags.hashCode();
    return h;
  }

  @Override public String toString() {
    return "TraceIntent{operationName=" + operationName
      + ", description=" + description
      + ", tags=" + tags + "}";
  }

  static boolean equal(@Nullable Object a, @Nullable Object b) {
    return a == null ? b == null : a.equals(b);
  }

  public static final class Builder {
    String operationName, description;
    final Map<String, String> tags = new LinkedHashMap<>();

    /** Null or empty resets to {@value ScopedOperationTracer#DEFAULT_OPERATION_NAME}. */
    public Builder operationName(@Nullable String operationName) {
      this.operationName = emptyToNull(operationName);
      return this;
    }

    /** Null or empty resets to the operation's display name. */
    public Builder description(@Nullable String description) {
      this.description = emptyToNull(description);
      return this;
    }

    public Builder tag(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (key.isEmpty()) throw new IllegalArgumentException("key is empty");
      if (value == null) throw new NullPointerException("value of " + key + " == null");
      tags.put(key, value);
      return this;
    }

    public TraceIntent build() {
      return new TraceIntent(this);
    }

    Builder() {
    }
  }

  @Nullable static String emptyToNull(@Nullable String input) {
    return input == null || input.isEmpty() ? null : input;
  }
}
