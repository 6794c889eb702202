package com.acme.delivery.core;

/**
 * Dot-separated subjects and subject patterns. In a pattern {@code *} matches exactly one token
 * and {@code >} matches one or more trailing tokens.
 */
public final class Subjects {

  private Subjects() {}

  /** Join a stream name and a subject pattern under it. Example: users + created -> users.created */
  public static String topic(String stream, String subject) {
    return stream + "." + subject;
  }

  /** The stream a topic belongs to: the first token. */
  public static String streamOf(String topic) {
    int dot = topic.indexOf('.');
    return dot < 0 ? topic : topic.substring(0, dot);
  }

  public static boolean matches(String pattern, String subject) {
    String[] p = pattern.split("\\.", -1);
    String[] s = subject.split("\\.", -1);
    for (int i = 0; i < p.length; i++) {
      if (p[i].equals(">")) {
        return s.length > i;
      }
      if (i >= s.length) {
        return false;
      }
      if (!p[i].equals("*") && !p[i].equals(s[i])) {
        return false;
      }
    }
    return p.length == s.length;
  }

  /**
   * Reject empty tokens, wildcards mixed into a token and {@code >} anywhere but at the end.
   *
   * @throws IllegalArgumentException if the pattern is malformed
   */
  public static String requireValidPattern(String pattern) {
    if (pattern == null || pattern.isBlank()) {
      throw new IllegalArgumentException("subject must not be empty");
    }
    String[] tokens = pattern.split("\\.", -1);
    for (int i = 0; i < tokens.length; i++) {
      String token = tokens[i];
      if (token.isEmpty()) {
        throw new IllegalArgumentException("empty token in subject '" + pattern + "'");
      }
      boolean wildcard = token.equals("*") || token.equals(">");
      if (!wildcard && (token.contains("*") || token.contains(">"))) {
        throw new IllegalArgumentException("wildcard inside token in subject '" + pattern + "'");
      }
      if (token.equals(">") && i != tokens.length - 1) {
        throw new IllegalArgumentException("'>' must be the last token in subject '" + pattern + "'");
      }
      if (token.chars().anyMatch(Character::isWhitespace)) {
        throw new IllegalArgumentException("whitespace in subject '" + pattern + "'");
      }
    }
    return pattern;
  }
}
