/*
 * どこで: Healthion サービス層
 * 何を: bearer token から現在ユーザーを解決し、未連携なら upstream 登録を試みる
 * なぜ: 全 API で同じ email 補完と登録ポリシーを適用するため
 */
package com.healthion.bff.service;

import com.healthion.bff.config.IdentityProviderProperties;
import com.healthion.bff.model.CurrentUser;
import com.healthion.bff.model.UserRecord;
import com.healthion.bff.model.VerifiedIdentity;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CurrentUserService {

  private static final Logger logger = LoggerFactory.getLogger(CurrentUserService.class);

  private final IdentityClaimsMapper identityClaimsMapper;
  private final IdentityProviderUserInfoClient userInfoClient;
  private final IdentityResolveService identityResolveService;
  private final UpstreamRegistrationService upstreamRegistrationService;
  private final IdentityProviderProperties identityProviderProperties;

  public CurrentUser resolve(@NonNull JwtAuthenticationToken authentication) {
    final VerifiedIdentity identity = identityClaimsMapper.map(authentication);
    final String email = resolveEmail(identity, authentication.getToken().getTokenValue());
    final UserRecord user = identityResolveService.resolve(identity.externalIdentityId(), email);
    return new CurrentUser(registerBestEffort(user), identity.permissions());
  }

  private String resolveEmail(VerifiedIdentity identity, String accessToken) {
    if (identity.hasEmail()) {
      return identity.email();
    }
    return userInfoClient
        .fetchEmail(accessToken)
        .orElseGet(
            () -> {
              logger.warn("email unavailable from token and userinfo, using fallback address");
              return identity.externalIdentityId()
                  + "@"
                  + identityProviderProperties.fallbackEmailDomain();
            });
  }

  // 登録失敗はリクエストを失敗させない。次回リクエストで再試行される。
  private UserRecord registerBestEffort(UserRecord user) {
    if (user.isLinkedUpstream()) {
      return user;
    }
    try {
      return upstreamRegistrationService.ensureRegistered(user).user();
    } catch (UpstreamIntegrationException ex) {
      if (ex.reason() == UpstreamIntegrationException.Reason.NOT_CONFIGURED) {
        logger.error("wearables platform is not configured, user_id={} stays unlinked", user.id());
      } else {
        logger.warn(
            "upstream registration deferred user_id={} reason={}", user.id(), ex.reason());
      }
      return user;
    } catch (UserPersistenceException ex) {
      logger.warn("upstream registration deferred user_id={} cause={}", user.id(), ex.getMessage());
      return user;
    }
  }
}
