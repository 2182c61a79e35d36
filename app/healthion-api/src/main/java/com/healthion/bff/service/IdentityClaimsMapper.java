package com.healthion.bff.service;

import com.healthion.bff.config.IdentityProviderProperties;
import com.healthion.bff.model.VerifiedIdentity;
import java.util.List;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class IdentityClaimsMapper {

  private static final String PERMISSIONS_CLAIM = "permissions";
  private static final String EMAIL_CLAIM = "email";

  private final IdentityProviderProperties properties;

  public VerifiedIdentity map(@NonNull JwtAuthenticationToken authentication) {
    final Jwt jwt = authentication.getToken();
    final String subject = jwt.getSubject();
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("token subject is required");
    }
    return new VerifiedIdentity(subject, permissions(jwt), email(jwt));
  }

  private List<String> permissions(Jwt jwt) {
    if (!jwt.hasClaim(PERMISSIONS_CLAIM)) {
      return List.of();
    }
    final List<String> values = jwt.getClaimAsStringList(PERMISSIONS_CLAIM);
    return values == null ? List.of() : values;
  }

  // IdP によっては email を audience 名前空間付きのカスタム claim で渡す。
  private String email(Jwt jwt) {
    final String direct = jwt.getClaimAsString(EMAIL_CLAIM);
    if (direct != null && !direct.isBlank()) {
      return direct;
    }
    final String namespaced = jwt.getClaimAsString(properties.namespacedEmailClaim());
    if (namespaced != null && !namespaced.isBlank()) {
      return namespaced;
    }
    return null;
  }
}
