package io.b2mash.b2b.reportengine.report;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import java.util.ArrayList;
import java.util.Locale;
import java.util.UUID;
import org.springframework.data.jpa.domain.Specification;

/** Criteria for the paged report list. */
public final class SavedReportSpecifications {

  /**
   * Reports in the organization that the member may list.
   *
   * <ul>
   *   <li>No visibility requested: the member's own reports plus every TEAM or EVERYONE report.
   *       A search term is added to that OR-list, so it widens the result.
   *   <li>PRIVATE: only the member's own private reports, never anyone else's.
   *   <li>TEAM or EVERYONE: every report with exactly that visibility. A search term narrows.
   * </ul>
   */
  public static Specification<SavedReport> listable(
      String orgId, UUID memberId, ReportVisibility visibility, Boolean template, String search) {
    return (root, query, cb) -> {
      var predicates = new ArrayList<Predicate>();
      predicates.add(cb.equal(root.get("organizationId"), orgId));

      boolean hasSearch = search != null && !search.isBlank();
      if (visibility == null) {
        var anyOf = new ArrayList<Predicate>();
        anyOf.add(cb.equal(root.get("createdById"), memberId));
        anyOf.add(root.get("visibility").in(ReportVisibility.TEAM, ReportVisibility.EVERYONE));
        if (hasSearch) {
          anyOf.add(matchesSearch(root, cb, search));
        }
        predicates.add(cb.or(anyOf.toArray(Predicate[]::new)));
      } else {
        if (visibility == ReportVisibility.PRIVATE) {
          predicates.add(cb.equal(root.get("createdById"), memberId));
        }
        predicates.add(cb.equal(root.get("visibility"), visibility));
        if (hasSearch) {
          predicates.add(matchesSearch(root, cb, search));
        }
      }

      if (template != null) {
        predicates.add(cb.equal(root.get("template"), template));
      }
      return cb.and(predicates.toArray(Predicate[]::new));
    };
  }

  private static Predicate matchesSearch(
      Root<SavedReport> root, CriteriaBuilder cb, String search) {
    String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
    return cb.or(
        cb.like(cb.lower(root.get("name")), pattern),
        cb.like(cb.lower(root.get("description")), pattern));
  }

  private SavedReportSpecifications() {}
}
