package com.acme.delivery.stream;

/**
 * Durable consumer names. The same stream, namespace and subject always give the same name, so a
 * restarted consumer resumes its broker-side cursor instead of creating a new one.
 */
public final class DurableNames {

  private DurableNames() {}

  /**
   * Example: (users, billing, users.*.created) -> users_billing_users_opts_created
   *
   * <p>{@code .} becomes {@code _}, {@code *} becomes {@code opts} and {@code >} becomes
   * {@code spread}.
   */
  public static String of(String stream, String namespace, String subject) {
    StringBuilder safe = new StringBuilder(subject.length() + 16);
    for (int i = 0; i < subject.length(); i++) {
      char c = subject.charAt(i);
      switch (c) {
        case '.' -> safe.append('_');
        case '*' -> safe.append("opts");
        case '>' -> safe.append("spread");
        default -> safe.append(c);
      }
    }
    return stream + "_" + namespace + "_" + safe;
  }
}
