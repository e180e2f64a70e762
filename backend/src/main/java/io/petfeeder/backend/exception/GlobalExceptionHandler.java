package io.petfeeder.backend.exception;

import io.petfeeder.backend.schedule.ScheduleConflictException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ScheduleConflictException.class)
  public ResponseEntity<ProblemDetail> handleScheduleConflict(
      ScheduleConflictException ex, HttpServletRequest request) {
    log.warn(
        "Conditional write rejected: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("Schedule was modified concurrently. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  /** Store errors are logged in full but never echoed, so table names and ARNs stay private. */
  @ExceptionHandler(StoreException.class)
  public ResponseEntity<ProblemDetail> handleStoreFailure(
      StoreException ex, HttpServletRequest request) {
    log.error(
        "Store failure: path={}, method={}", request.getRequestURI(), request.getMethod(), ex);
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Storage unavailable");
    problem.setDetail("An error occurred with the cloud service");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
  }
}
