package com.teamplatform.provisioning.config;

import com.teamplatform.provisioning.credential.AuthorizationGate;
import com.teamplatform.provisioning.credential.CredentialAudience;
import com.teamplatform.provisioning.credential.TenantAccessDeniedException;
import java.util.function.Supplier;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

/**
 * パス変数 {@code tenantId} を対象に AuthorizationGate のテナント/プラットフォーム判定を行う。
 * allowInternalService が true の経路では内部サービス資格情報も通す。
 */
public class TenantScopeAuthorizationManager
    implements AuthorizationManager<RequestAuthorizationContext> {

  private final AuthorizationGate authorizationGate;
  private final boolean allowInternalService;

  public TenantScopeAuthorizationManager(
      AuthorizationGate authorizationGate, boolean allowInternalService) {
    this.authorizationGate = authorizationGate;
    this.allowInternalService = allowInternalService;
  }

  @Override
  public AuthorizationDecision check(
      Supplier<Authentication> authentication, RequestAuthorizationContext context) {
    final Authentication auth = authentication.get();
    if (!(auth instanceof CredentialAuthenticationToken token) || !auth.isAuthenticated()) {
      return new AuthorizationDecision(false);
    }
    if (allowInternalService
        && token.credential().audience() == CredentialAudience.INTERNAL_SERVICE) {
      return new AuthorizationDecision(true);
    }
    final String tenantId = context.getVariables().get("tenantId");
    try {
      authorizationGate.requireTenantOrPlatform(token.credential(), tenantId);
      return new AuthorizationDecision(true);
    } catch (TenantAccessDeniedException ex) {
      // 拒否理由は AuthorizationGate がログとメトリクスに記録済み
      return new AuthorizationDecision(false);
    }
  }
}
