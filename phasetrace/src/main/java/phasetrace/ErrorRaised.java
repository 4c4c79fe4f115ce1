/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

import brave.internal.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/** The pipeline is handling an error instead of a normal result. */
public final class ErrorRaised extends Checkpoint {
  public static final String ERROR_KIND = "exception.class";
  public static final String ERROR_MESSAGE = "exception.message";
  public static final String ERROR_LOCATION = "exception.location";

  /** Derives the kind, message and location from the throwable's top stack frame. */
  public static ErrorRaised create(Throwable error) {
    if (error == null) throw new NullPointerException("error == null");
    return new ErrorRaised(error.getClass().getName(), error.getMessage(), location(error), error);
  }

  public static ErrorRaised create(String errorKind, @Nullable String message,
    @Nullable String location) {
    if (errorKind == null) throw new NullPointerException("errorKind == null");
    return new ErrorRaised(errorKind, message, location, null);
  }

  final String errorKind;
  @Nullable final String message, location;
  @Nullable final Throwable error;

  ErrorRaised(String errorKind, @Nullable String message, @Nullable String location,
    @Nullable Throwable error) {
    this.errorKind = errorKind;
    this.message = message;
    this.location = location;
    this.error = error;
  }

  @Override public Type type() {
    return Type.ERROR_RAISED;
  }

  public String errorKind() {
    return errorKind;
  }

  @Nullable public String message() {
    return message;
  }

  /** Source file and line that raised the error. ex "BookResource.java:42" */
  @Nullable public String location() {
    return location;
  }

  @Nullable public Throwable error() {
    return error;
  }

  @Override public Map<String, String> metadata() {
    Map<String, String> result = new LinkedHashMap<>();
    result.put(ERROR_KIND, errorKind);
    if (message != null) result.put(ERROR_MESSAGE, message);
    if (location != null) result.put(ERROR_LOCATION, location);
    return result;
  }

  @Nullable static String location(Throwable error) {
    StackTraceElement[] trace = error.getStackTrace();
    if (trace.length == 0) return null;
    StackTraceElement top = trace[0];
    if (top.getFileName() == null) return top.getClassName();
    return top.getLineNumber() > 0 ? top.getFileName() + ":" + top.getLineNumber()
      : top.getFileName();
  }
}
