package io.b2mash.content.security;

/**
 * The authenticated caller as asserted by the upstream gateway. {@code role} is a global role tag
 * (e.g. "admin", "user"), unrelated to project membership roles.
 */
public record CallerIdentity(String userId, String email, String role) {

  public boolean isAdmin() {
    return Roles.GLOBAL_ADMIN.equals(role);
  }
}
