/*
 * Where: Dock notification debug API
 * What: Queue counts and dead-lettered job inspection
 * Why: Dead-lettered jobs raise no alert, operators look them up here
 */
package com.example.docknotification.api;

import com.example.docknotification.queue.NotificationQueue;
import com.example.docknotification.queue.QueuePair;
import com.example.docknotification.service.NotificationSubsystem;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/notification-queues")
@RequiredArgsConstructor
public class NotificationQueueController {

  static final int MAX_FAILED_LIMIT = 100;

  private final NotificationSubsystem subsystem;

  @GetMapping
  public NotificationQueuesResponse queues() {
    final List<QueueCountsResponse> counts =
        subsystem
            .queues()
            .map(QueuePair::all)
            .orElse(List.of())
            .stream()
            .map(queue -> QueueCountsResponse.of(queue.name(), queue.counts()))
            .toList();
    return new NotificationQueuesResponse(
        subsystem.mode().value(), subsystem.isBrokerHealthy(), counts);
  }

  @GetMapping("/{queue}/failed")
  public FailedJobsResponse failed(
      @PathVariable("queue") String queueName,
      @RequestParam(name = "limit", defaultValue = "20") int limit) {
    final NotificationQueue queue =
        subsystem
            .queues()
            .flatMap(pair -> pair.find(queueName))
            .orElseThrow(() -> new QueueNotFoundException(queueName));
    final int boundedLimit = Math.max(1, Math.min(limit, MAX_FAILED_LIMIT));
    final List<FailedJobSummary> jobs =
        queue.failedJobs(boundedLimit).stream()
            .map(
                job ->
                    new FailedJobSummary(
                        job.id(),
                        job.name(),
                        job.attemptsMade(),
                        job.failedReason(),
                        job.finishedAt(),
                        job.data()))
            .toList();
    return new FailedJobsResponse(queue.name(), jobs);
  }
}
