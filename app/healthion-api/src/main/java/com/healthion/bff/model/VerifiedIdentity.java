/*
 * どこで: app/healthion-api/src/main/java/com/healthion/bff/model/VerifiedIdentity.java
 * 何を: 検証済み bearer token から抽出した同定情報
 * なぜ: トークン処理とユーザー解決を分離してテストしやすくするため
 */
package com.healthion.bff.model;

import java.util.List;

public record VerifiedIdentity(String externalIdentityId, List<String> permissions, String email) {

  public VerifiedIdentity {
    permissions = permissions == null ? List.of() : List.copyOf(permissions);
  }

  public boolean hasEmail() {
    return email != null && !email.isBlank();
  }
}
