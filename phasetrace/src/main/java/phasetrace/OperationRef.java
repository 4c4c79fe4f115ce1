/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package phasetrace;

/**
 * Normalized identity of the operation a request dispatches to: the declaring class and the
 * method name. Integrations resolve this once per request from whatever handler representation the
 * pipeline uses.
 */
public final class OperationRef {
  public static OperationRef create(Class<?> type, String methodName) {
    if (type == null) throw new NullPointerException("type == null");
    return create(type.getName(), methodName);
  }

  public static OperationRef create(String className, String methodName) {
    if (className == null) throw new NullPointerException("className == null");
    if (methodName == null) throw new NullPointerException("methodName == null");
    if (className.isEmpty()) throw new IllegalArgumentException("className is empty");
    if (methodName.isEmpty()) throw new IllegalArgumentException("methodName is empty");
    return new OperationRef(className, methodName);
  }

  final String className, methodName;

  OperationRef(String className, String methodName) {
    this.className = className;
    this.methodName = methodName;
  }

  /** Fully qualified class name. ex "com.example.BookResource" */
  public String className() {
    return className;
  }

  public String methodName() {
    return methodName;
  }

  /** Short form used in span descriptions. ex "BookResource::listOfBooks" */
  public String displayName() {
    int dot = className.lastIndexOf('.');
    String simpleName = dot == -1 ? className : className.substring(dot + 1);
    return simpleName + "::" + methodName;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof OperationRef)) return false;
    OperationRef that = (OperationRef) o;
    return className.equals(that.className) && methodName.equals(that.methodName);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= className.hashCode();
    h *= 1000003;
    h ^= methodName.hashCode();
    return h;
  }

  @Override public String toString() {
    return className + "#" + methodName;
  }
}
