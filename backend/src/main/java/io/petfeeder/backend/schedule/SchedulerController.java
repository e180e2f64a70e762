package io.petfeeder.backend.schedule;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** On-demand trigger for external schedulers (EventBridge rule, cron). */
@RestController
@RequestMapping("/internal/scheduler")
public class SchedulerController {

  private final ScheduleExecutor scheduleExecutor;

  public SchedulerController(ScheduleExecutor scheduleExecutor) {
    this.scheduleExecutor = scheduleExecutor;
  }

  @PostMapping("/run")
  public ResponseEntity<ScheduleRunResult> run() {
    var result = scheduleExecutor.run();
    return ResponseEntity.status(result.statusCode()).body(result);
  }
}
