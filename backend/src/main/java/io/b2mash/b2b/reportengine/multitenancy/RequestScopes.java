package io.b2mash.b2b.reportengine.multitenancy;

import io.b2mash.b2b.reportengine.exception.MissingOrganizationContextException;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Request-scoped identity for multitenancy and member resolution. Bound by servlet filters, read by
 * controllers and services.
 *
 * <p>Each binding is an immutable {@link Snapshot}. {@link Binding#close()} restores whatever was
 * bound before, so nested bindings (tenant filter, then member filter) unwind in order and nothing
 * leaks onto pooled threads.
 */
public final class RequestScopes {

  private static final Snapshot EMPTY = new Snapshot(null, null, null);
  private static final ThreadLocal<Snapshot> CURRENT = ThreadLocal.withInitial(() -> EMPTY);

  /**
   * Identity values visible to the current request.
   *
   * @param orgId tenant organization id from the {@code org_id} claim
   * @param memberId resolved member id within the organization
   * @param orgRole the member's org role (e.g. "SYSTEM_ADMIN")
   */
  public record Snapshot(String orgId, UUID memberId, String orgRole) {}

  /** Restores the previous snapshot when closed. */
  public static final class Binding implements AutoCloseable {

    private final Snapshot previous;

    private Binding(Snapshot previous) {
      this.previous = previous;
    }

    @Override
    public void close() {
      if (previous == EMPTY) {
        CURRENT.remove();
      } else {
        CURRENT.set(previous);
      }
    }
  }

  /** Binds the organization, clearing any member binding. Bound by TenantFilter. */
  public static Binding bindOrganization(String orgId) {
    return bind(new Snapshot(orgId, null, null));
  }

  /** Binds the member on top of the current organization. Bound by MemberFilter. */
  public static Binding bindMember(UUID memberId, String orgRole) {
    return bind(new Snapshot(CURRENT.get().orgId(), memberId, orgRole));
  }

  /** Runs the action with the given identity bound, restoring the previous one afterwards. */
  public static <T> T callAs(Snapshot snapshot, Supplier<T> action) {
    try (var ignored = bind(snapshot)) {
      return action.get();
    }
  }

  /** Runs the action inside the given organization without a member (system actor). */
  public static void runInOrganization(String orgId, Runnable action) {
    try (var ignored = bindOrganization(orgId)) {
      action.run();
    }
  }

  private static Binding bind(Snapshot snapshot) {
    var binding = new Binding(CURRENT.get());
    CURRENT.set(snapshot);
    return binding;
  }

  /** Returns the current member's UUID. Throws if not bound by filter chain. */
  public static UUID requireMemberId() {
    UUID memberId = CURRENT.get().memberId();
    if (memberId == null) {
      throw new MemberContextNotBoundException();
    }
    return memberId;
  }

  /** Returns the current member's UUID, or null if not bound. */
  public static UUID getMemberIdOrNull() {
    return CURRENT.get().memberId();
  }

  /** Returns the organization id. Throws if not bound by filter chain. */
  public static String requireOrgId() {
    String orgId = CURRENT.get().orgId();
    if (orgId == null) {
      throw new MissingOrganizationContextException();
    }
    return orgId;
  }

  /** Returns the organization id, or null if not bound. */
  public static String getOrgIdOrNull() {
    return CURRENT.get().orgId();
  }

  /** Returns the current member's org role, or null if not bound. */
  public static String getOrgRole() {
    return CURRENT.get().orgRole();
  }

  private RequestScopes() {}
}
