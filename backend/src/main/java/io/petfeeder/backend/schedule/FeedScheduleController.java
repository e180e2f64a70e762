package io.petfeeder.backend.schedule;

import io.petfeeder.backend.schedule.dto.CreateScheduleRequest;
import io.petfeeder.backend.schedule.dto.ScheduleListResponse;
import io.petfeeder.backend.schedule.dto.ScheduleResponse;
import io.petfeeder.backend.schedule.dto.UpdateScheduleRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/schedules")
public class FeedScheduleController {

  private final FeedScheduleService scheduleService;

  public FeedScheduleController(FeedScheduleService scheduleService) {
    this.scheduleService = scheduleService;
  }

  @GetMapping
  public ResponseEntity<ScheduleListResponse> listSchedules(
      @RequestParam(defaultValue = "1") int page,
      @RequestParam(name = "page_size", defaultValue = "10") int pageSize,
      @RequestParam(name = "requested_by", required = false) String requestedBy) {
    return ResponseEntity.ok(scheduleService.list(page, pageSize, requestedBy));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ScheduleResponse> getSchedule(@PathVariable String id) {
    return ResponseEntity.ok(scheduleService.get(id));
  }

  @PostMapping
  public ResponseEntity<ScheduleResponse> createSchedule(
      @Valid @RequestBody CreateScheduleRequest request) {
    var response = scheduleService.create(request);
    return ResponseEntity.created(URI.create("/api/schedules/" + response.scheduleId()))
        .body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<ScheduleResponse> updateSchedule(
      @PathVariable String id, @Valid @RequestBody UpdateScheduleRequest request) {
    return ResponseEntity.ok(scheduleService.update(id, request));
  }

  @PatchMapping("/{id}/enabled")
  public ResponseEntity<ScheduleResponse> setEnabled(
      @PathVariable String id, @RequestParam boolean enabled) {
    return ResponseEntity.ok(scheduleService.setEnabled(id, enabled));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteSchedule(@PathVariable String id) {
    scheduleService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{id}/executions")
  public ResponseEntity<List<ScheduleExecution>> listExecutions(
      @PathVariable String id, @RequestParam(defaultValue = "20") int limit) {
    return ResponseEntity.ok(scheduleService.listExecutions(id, limit));
  }
}
