package io.intellixity.vigil.server.web;

import io.intellixity.vigil.governance.Governance;
import io.intellixity.vigil.governance.GovernanceContext;
import io.intellixity.vigil.governance.Role;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** Binds the caller's organization, user and role from request headers for the rest of the request. */
@Component
public final class TenantGovernanceFilter extends OncePerRequestFilter {
  public static final String ORG_HEADER = "X-Organization-Id";
  public static final String USER_HEADER = "X-User-Id";
  public static final String ROLE_HEADER = "X-Role";

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api/");
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {

    String orgId = request.getHeader(ORG_HEADER);
    if (orgId == null || orgId.isBlank()) {
      response.sendError(400, "Missing required header: " + ORG_HEADER);
      return;
    }

    Role role;
    try {
      role = Role.parse(request.getHeader(ROLE_HEADER));
    } catch (IllegalArgumentException e) {
      response.sendError(400, "Invalid header " + ROLE_HEADER + ": " + e.getMessage());
      return;
    }

    String userId = request.getHeader(USER_HEADER);
    if (userId != null && userId.isBlank()) userId = null;
    GovernanceContext ctx = GovernanceContext.forUser(orgId.trim(), userId == null ? null : userId.trim(), role);

    try {
      Governance.inContext(ctx, () -> {
        try {
          filterChain.doFilter(request, response);
        } catch (Exception e) {
          throw new RuntimeException(e);
        }
        return null;
      });
    } catch (RuntimeException e) {
      Throwable c = e.getCause();
      if (c instanceof IOException ioe) throw ioe;
      if (c instanceof ServletException se) throw se;
      throw e;
    }
  }
}
