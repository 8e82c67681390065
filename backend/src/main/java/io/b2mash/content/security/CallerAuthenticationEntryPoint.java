package io.b2mash.content.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Logs structured authentication failure warnings before delegating to {@link HttpStatusEntryPoint}
 * for the actual 401 response.
 */
@Component
public class CallerAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(CallerAuthenticationEntryPoint.class);

  private final HttpStatusEntryPoint delegate = new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED);

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    log.warn(
        "security.auth_failed: path={}, method={}, reason={}, remote_addr={}",
        request.getRequestURI(),
        request.getMethod(),
        authException.getMessage(),
        request.getRemoteAddr());

    delegate.commence(request, response, authException);
  }
}
