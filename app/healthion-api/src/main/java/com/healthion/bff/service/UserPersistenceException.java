/*
 * どこで: Healthion サービス層
 * 何を: users テーブルへの書き込み/再読込の失敗を表す例外
 * なぜ: upstream 連携失敗と区別し、呼び出し側が再試行可否を判断できるようにするため
 */
package com.healthion.bff.service;

public class UserPersistenceException extends RuntimeException {

  private final String userId;
  private final String operation;

  public UserPersistenceException(String userId, String operation, Throwable cause) {
    super(operation + " failed for user_id=" + userId, cause);
    this.userId = userId;
    this.operation = operation;
  }

  public UserPersistenceException(String userId, String operation, String detail) {
    super(operation + " failed for user_id=" + userId + ": " + detail);
    this.userId = userId;
    this.operation = operation;
  }

  private UserPersistenceException(Throwable cause, String operation, String message) {
    super(message, cause);
    this.userId = null;
    this.operation = operation;
  }

  /** ローカルユーザーが未確定の段階 (subject からの解決中) の失敗。userId は null になる。 */
  public static UserPersistenceException forIdentity(
      String externalIdentityId, String operation, Throwable cause) {
    return new UserPersistenceException(
        cause,
        operation,
        operation + " failed for external_identity_id=" + externalIdentityId);
  }

  public String userId() {
    return userId;
  }

  public String operation() {
    return operation;
  }
}
