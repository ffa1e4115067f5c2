package com.example.commitment.config;

import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

/** パス変数の利用者 ID と認証済み利用者が一致するか、特権ロールを持つときだけ許可する。 */
public class UserOwnershipAuthorizationManager
    implements AuthorizationManager<RequestAuthorizationContext> {

  private static final Logger logger =
      LoggerFactory.getLogger(UserOwnershipAuthorizationManager.class);

  private final String ownerVariable;
  private final Set<String> bypassAuthorities;

  public UserOwnershipAuthorizationManager(String ownerVariable, Set<String> bypassAuthorities) {
    this.ownerVariable = ownerVariable;
    this.bypassAuthorities = Set.copyOf(bypassAuthorities);
  }

  @Override
  public AuthorizationDecision check(
      Supplier<Authentication> authentication, RequestAuthorizationContext context) {
    final Authentication auth = authentication.get();
    if (auth == null || !auth.isAuthenticated()) {
      return new AuthorizationDecision(false);
    }
    if (hasBypassAuthority(auth)) {
      return new AuthorizationDecision(true);
    }
    final String ownerId = context.getVariables().get(ownerVariable);
    final boolean granted = ownerId != null && !ownerId.isBlank() && ownerId.equals(auth.getName());
    if (!granted) {
      logger.debug(
          "ownership check denied principal={} path={}",
          auth.getName(),
          context.getRequest().getRequestURI());
    }
    return new AuthorizationDecision(granted);
  }

  private boolean hasBypassAuthority(Authentication auth) {
    for (GrantedAuthority authority : auth.getAuthorities()) {
      if (bypassAuthorities.contains(authority.getAuthority())) {
        return true;
      }
    }
    return false;
  }
}
