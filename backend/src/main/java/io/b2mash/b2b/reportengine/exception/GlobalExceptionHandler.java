package io.b2mash.b2b.reportengine.exception;

import io.b2mash.b2b.reportengine.audit.AuditEventBuilder;
import io.b2mash.b2b.reportengine.audit.AuditService;
import io.b2mash.b2b.reportengine.multitenancy.MemberContextNotBoundException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final AuditService auditService;

  public GlobalExceptionHandler(AuditService auditService) {
    this.auditService = auditService;
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());
    auditAccessDenied(request, "insufficient_role");

    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    String reason = ex.getBody().getDetail();
    log.warn(
        "Forbidden: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        reason);
    auditAccessDenied(request, reason != null ? reason : "forbidden");

    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler(ScheduleLinkFailedException.class)
  public ResponseEntity<ProblemDetail> handleScheduleLinkFailed(ScheduleLinkFailedException ex) {
    log.error(
        "Scheduled export {} left unlinked: {}", ex.getScheduleId(), ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ex.getBody());
  }

  @ExceptionHandler(MemberContextNotBoundException.class)
  public ResponseEntity<ProblemDetail> handleMemberContextNotBound(
      MemberContextNotBoundException ex) {
    log.error("Member context invariant violation: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Member context not available");
    problem.setDetail("Unable to resolve member identity for request");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  private void auditAccessDenied(HttpServletRequest request, String reason) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("security.access_denied")
            .entityType("security")
            .entityId(UUID.randomUUID())
            .details(
                Map.of(
                    "path", request.getRequestURI(),
                    "method", request.getMethod(),
                    "reason", reason))
            .build());
  }
}
