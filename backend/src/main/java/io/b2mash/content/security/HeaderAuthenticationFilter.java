package io.b2mash.content.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the caller identity forwarded by the gateway. All three headers must be present and
 * non-blank; otherwise the request continues unauthenticated and the authorization rules reject it
 * with 401.
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

  public static final String USER_ID_HEADER = "X-User-Id";
  public static final String USER_EMAIL_HEADER = "X-User-Email";
  public static final String USER_ROLE_HEADER = "X-User-Role";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String userId = request.getHeader(USER_ID_HEADER);
    String email = request.getHeader(USER_EMAIL_HEADER);
    String role = request.getHeader(USER_ROLE_HEADER);

    if (hasText(userId) && hasText(email) && hasText(role)) {
      var caller = new CallerIdentity(userId.trim(), email.trim(), role.trim());
      var context = SecurityContextHolder.createEmptyContext();
      context.setAuthentication(new CallerAuthenticationToken(caller));
      SecurityContextHolder.setContext(context);
    }

    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  static class CallerAuthenticationToken extends AbstractAuthenticationToken {

    private final CallerIdentity caller;

    CallerAuthenticationToken(CallerIdentity caller) {
      super(List.of(new SimpleGrantedAuthority("ROLE_" + caller.role().toUpperCase(Locale.ROOT))));
      this.caller = caller;
      setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
      return null;
    }

    @Override
    public Object getPrincipal() {
      return caller;
    }
  }
}
