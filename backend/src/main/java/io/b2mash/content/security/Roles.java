package io.b2mash.content.security;

/**
 * Centralized role constants.
 *
 * <p>Project roles live in the {@code project_members} table and are scoped to one project. The
 * global role arrives with the caller identity ({@code X-User-Role}) and is not stored anywhere;
 * {@link #GLOBAL_ADMIN} is the only global value the service acts on.
 */
public final class Roles {

  // Project-level roles (project_members.role values)
  public static final String PROJECT_OWNER = "owner";
  public static final String PROJECT_MEMBER = "member";
  public static final String PROJECT_VIEWER = "viewer";

  // Global role asserted by the upstream gateway
  public static final String GLOBAL_ADMIN = "admin";

  private Roles() {}

  /**
   * Normalizes a role requested for a non-owner membership. Only member and viewer can be granted;
   * anything else, owner included, becomes member.
   */
  public static String grantableProjectRole(String requested) {
    if (PROJECT_VIEWER.equals(requested)) {
      return PROJECT_VIEWER;
    }
    return PROJECT_MEMBER;
  }
}
