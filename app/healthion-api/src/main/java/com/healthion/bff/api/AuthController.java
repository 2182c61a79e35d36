/*
 * どこで: app/healthion-api/src/main/java/com/healthion/bff/api/AuthController.java
 * 何を: 現在ユーザー情報 API を提供
 * なぜ: フロントエンドがログイン直後にローカルユーザーと連携状態を確認できるようにするため
 */
package com.healthion.bff.api;

import com.healthion.bff.api.response.MeResponse;
import com.healthion.bff.model.CurrentUser;
import com.healthion.bff.service.CurrentUserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/auth")
@RequiredArgsConstructor
public class AuthController {

  private final CurrentUserService currentUserService;

  /**
   * 役割:
   * - bearer token の利用者に対応するローカルユーザーを返す。
   *
   * 期待動作:
   * - 初回アクセスでは users 行を作成し、upstream 登録を試みる。
   * - upstream 登録に失敗しても 200 を返し、upstreamUserId は null のままになる。
   */
  @GetMapping("/me")
  public ResponseEntity<MeResponse> me(JwtAuthenticationToken authentication) {
    final CurrentUser current = currentUserService.resolve(authentication);
    return ResponseEntity.ok(
        new MeResponse(
            current.user().id(),
            current.user().externalIdentityId(),
            current.user().email(),
            current.permissions(),
            current.user().upstreamUserId()));
  }
}
