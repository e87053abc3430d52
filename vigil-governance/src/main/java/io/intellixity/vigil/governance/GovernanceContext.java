package io.intellixity.vigil.governance;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-request/job governance context.\n
 *
 * Keys: {@link #ORG_ID}, {@link #USER_ID}, {@link #ROLE}.\n
 */
public interface GovernanceContext {
  String ORG_ID = "orgId";
  String USER_ID = "userId";
  String ROLE = "role";

  /** Return a context value or null if absent. */
  Object get(String key);

  /** Stable cache identity for this context. */
  String cacheKey();

  /** Return a required context value; throws if missing. */
  default Object getRequired(String key) {
    Objects.requireNonNull(key, "key");
    Object v = get(key);
    if (v == null) throw new IllegalStateException("Missing GovernanceContext key: " + key);
    return v;
  }

  default String organizationId() {
    return String.valueOf(getRequired(ORG_ID));
  }

  /** Role of the caller, or null for system work such as background jobs. */
  default Role role() {
    Object r = get(ROLE);
    if (r == null || r instanceof Role) return (Role) r;
    return Role.parse(r.toString());
  }

  /** Context of an authenticated caller. */
  static GovernanceContext forUser(String organizationId, String userId, Role role) {
    Objects.requireNonNull(organizationId, "organizationId");
    Objects.requireNonNull(role, "role");
    Map<String, Object> m = new HashMap<>();
    m.put(ORG_ID, organizationId);
    m.put(ROLE, role);
    if (userId != null) m.put(USER_ID, userId);
    return of(m, organizationId + ":" + (userId == null ? "-" : userId) + ":" + role);
  }

  /** Simple map-backed context with an explicit stable cache key. */
  static GovernanceContext of(Map<String, ?> values, String cacheKey) {
    Map<String, ?> m = values == null ? Map.of() : Map.copyOf(values);
    String ck = (cacheKey == null || cacheKey.isBlank()) ? ("map:" + m.hashCode()) : cacheKey;
    return new GovernanceContext() {
      @Override public Object get(String key) { return m.get(key); }
      @Override public String cacheKey() { return ck; }
      @Override public String toString() { return "GovernanceContext" + m; }
    };
  }
}
