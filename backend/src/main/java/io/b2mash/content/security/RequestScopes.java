package io.b2mash.content.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Request-scoped access to the caller identity bound by {@link HeaderAuthenticationFilter}. Read by
 * controllers; services receive the user id and role as plain arguments.
 */
public final class RequestScopes {

  private RequestScopes() {}

  /** Returns the current caller. Throws if the filter chain did not bind one. */
  public static CallerIdentity requireCaller() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication != null && authentication.getPrincipal() instanceof CallerIdentity caller) {
      return caller;
    }
    throw new CallerContextNotBoundException();
  }

  public static String requireUserId() {
    return requireCaller().userId();
  }
}
