package com.example.common;

import java.util.UUID;
import java.util.regex.Pattern;

/** リクエスト相関 ID の採番。上流から受け取った ID はログへ安全に載せられる形式のときだけ使う。 */
public final class RequestIds {

  private static final int MAX_LENGTH = 128;
  private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9._:-]+");

  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  public static String resolve(String candidate) {
    if (candidate == null) {
      return newRequestId();
    }
    final String trimmed = candidate.trim();
    if (trimmed.isEmpty()
        || trimmed.length() > MAX_LENGTH
        || !ALLOWED.matcher(trimmed).matches()) {
      return newRequestId();
    }
    return trimmed;
  }
}
