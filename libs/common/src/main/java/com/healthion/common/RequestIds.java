/*
 * どこで: Common ユーティリティ
 * 何を: リクエスト相関 ID を受け入れる/生成する
 * なぜ: クライアント由来のヘッダ値をそのままログへ出さないため
 */
package com.healthion.common;

import java.util.UUID;
import java.util.regex.Pattern;

public final class RequestIds {

  static final int MAX_LENGTH = 128;

  private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9._:-]+");

  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  /** ヘッダ値が安全な文字だけで構成されていればそれを使い、そうでなければ新しい ID を返す。 */
  public static String acceptOrNew(String candidate) {
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
