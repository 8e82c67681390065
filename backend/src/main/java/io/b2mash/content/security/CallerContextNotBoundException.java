package io.b2mash.content.security;

public class CallerContextNotBoundException extends RuntimeException {

  public CallerContextNotBoundException() {
    super("Caller context not available: no CallerIdentity bound by filter chain");
  }
}
