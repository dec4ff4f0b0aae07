/*
 * Where: Dock notification queue layer
 * What: Priority queue with delayed retries and bounded dead-letter retention on Redis
 * Why: Jobs must survive process restarts and be shared by every worker of a lane
 */
package com.example.docknotification.queue;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Layout under {@code nq:<queue>:}: one hash per job, sorted sets {@code wait}, {@code delayed}
 * and {@code active}, and lists {@code completed} and {@code failed} holding finished job ids
 * newest first.
 */
public class RedisNotificationQueue implements NotificationQueue {

  private static final Logger logger = LoggerFactory.getLogger(RedisNotificationQueue.class);

  static final String FIELD_NAME = "name";
  static final String FIELD_DATA = "data";
  static final String FIELD_PRIORITY = "priority";
  static final String FIELD_ATTEMPTS_MADE = "attempts_made";
  static final String FIELD_ENQUEUED_AT = "enqueued_at";
  static final String FIELD_TRACE_ID = "trace_id";
  static final String FIELD_STATE = "state";
  static final String FIELD_FAILED_REASON = "failed_reason";
  static final String FIELD_FINISHED_AT = "finished_at";

  static final String STATE_WAITING = "waiting";
  static final String STATE_DELAYED = "delayed";
  static final String STATE_ACTIVE = "active";
  static final String STATE_COMPLETED = "completed";
  static final String STATE_FAILED = "failed";

  static final int MAX_PRIORITY = 100;
  // epoch millis stay below 1e13 until the year 2286
  static final long PRIORITY_SPAN = 10_000_000_000_000L;

  private static final int MAX_CLAIM_SCAN = 20;

  // moves the head of the wait set into the active set in one step
  static final RedisScript<String> CLAIM_SCRIPT =
      new DefaultRedisScript<>(
          """
          local popped = redis.call('ZPOPMIN', KEYS[1])
          if popped[1] == nil then
            return false
          end
          redis.call('ZADD', KEYS[2], ARGV[1], popped[1])
          return popped[1]
          """,
          String.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate is a shared Spring-managed component and cannot be copied")
  private final StringRedisTemplate redisTemplate;

  private final QueueSettings settings;
  private final int errorMessageMaxLength;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public RedisNotificationQueue(
      StringRedisTemplate redisTemplate, QueueSettings settings, int errorMessageMaxLength) {
    this.redisTemplate = redisTemplate;
    this.settings = settings;
    this.errorMessageMaxLength = errorMessageMaxLength;
  }

  @Override
  public String name() {
    return settings.name();
  }

  @Override
  public QueueSettings settings() {
    return settings;
  }

  @Override
  public String add(String jobName, String data, int priority, String traceId, Instant now) {
    if (closed.get()) {
      throw new IllegalStateException("queue is closed: " + name());
    }
    final String jobId = UUID.randomUUID().toString();
    final Map<String, String> fields = new HashMap<>();
    fields.put(FIELD_NAME, jobName);
    fields.put(FIELD_DATA, data);
    fields.put(FIELD_PRIORITY, Integer.toString(priority));
    fields.put(FIELD_ATTEMPTS_MADE, "0");
    fields.put(FIELD_ENQUEUED_AT, now.toString());
    fields.put(FIELD_STATE, STATE_WAITING);
    if (traceId != null) {
      fields.put(FIELD_TRACE_ID, traceId);
    }

    redisTemplate.opsForHash().putAll(jobKey(name(), jobId), fields);
    redisTemplate.opsForZSet().add(waitKey(name()), jobId, waitScore(priority, now));
    return jobId;
  }

  @Override
  public Optional<QueuedJob> claimNext(Instant now) {
    recoverStalledJobs(now);
    promoteDueJobs(now);
    for (int i = 0; i < MAX_CLAIM_SCAN; i++) {
      final String jobId =
          redisTemplate.execute(
              CLAIM_SCRIPT,
              List.of(waitKey(name()), activeKey(name())),
              Long.toString(now.toEpochMilli()));
      if (jobId == null) {
        return Optional.empty();
      }
      final String jobKey = jobKey(name(), jobId);
      final Map<Object, Object> raw = redisTemplate.opsForHash().entries(jobKey);
      if (raw.isEmpty()) {
        logger.warn("queued job record missing queue={} jobId={}", name(), jobId);
        redisTemplate.opsForZSet().remove(activeKey(name()), jobId);
        continue;
      }
      redisTemplate.opsForHash().put(jobKey, FIELD_STATE, STATE_ACTIVE);
      return Optional.of(toQueuedJob(jobId, normalizeFields(raw)));
    }
    return Optional.empty();
  }

  // Outcome writes land before the active entry is removed, so a broker error part way through
  // leaves the job visible to the stalled sweep.
  @Override
  public void complete(QueuedJob job, Instant now) {
    final Map<String, String> fields = new HashMap<>();
    fields.put(FIELD_STATE, STATE_COMPLETED);
    fields.put(FIELD_FINISHED_AT, now.toString());
    redisTemplate.opsForHash().putAll(jobKey(name(), job.id()), fields);
    redisTemplate.opsForList().leftPush(completedKey(name()), job.id());
    redisTemplate.opsForZSet().remove(activeKey(name()), job.id());
    trimFinished(completedKey(name()), settings.retentionPolicy().keepCompleted());
  }

  @Override
  public FailureOutcome fail(QueuedJob job, String errorMessage, Instant now) {
    final FailureOutcome outcome =
        recordFailedAttempt(job.id(), job.attemptsMade() + 1, errorMessage, now);
    redisTemplate.opsForZSet().remove(activeKey(name()), job.id());
    return outcome;
  }

  @Override
  public void discard(QueuedJob job, String errorMessage, Instant now) {
    final Map<String, String> fields = new HashMap<>();
    fields.put(FIELD_ATTEMPTS_MADE, Integer.toString(job.attemptsMade() + 1));
    fields.put(FIELD_FAILED_REASON, truncateError(errorMessage));
    deadLetter(job.id(), fields, now);
    redisTemplate.opsForZSet().remove(activeKey(name()), job.id());
  }

  @Override
  public QueueCounts counts() {
    final ZSetOperations<String, String> zset = redisTemplate.opsForZSet();
    return new QueueCounts(
        orZero(zset.size(waitKey(name()))),
        orZero(zset.size(delayedKey(name()))),
        orZero(zset.size(activeKey(name()))),
        orZero(redisTemplate.opsForList().size(completedKey(name()))),
        orZero(redisTemplate.opsForList().size(failedKey(name()))));
  }

  @Override
  public List<FailedJob> failedJobs(int limit) {
    if (limit <= 0) {
      return List.of();
    }
    final List<String> ids = redisTemplate.opsForList().range(failedKey(name()), 0, limit - 1L);
    if (ids == null || ids.isEmpty()) {
      return List.of();
    }
    final List<FailedJob> jobs = new ArrayList<>(ids.size());
    for (String jobId : ids) {
      final Map<Object, Object> raw = redisTemplate.opsForHash().entries(jobKey(name(), jobId));
      if (raw.isEmpty()) {
        continue;
      }
      final Map<String, String> fields = normalizeFields(raw);
      jobs.add(
          new FailedJob(
              jobId,
              fields.get(FIELD_NAME),
              fields.get(FIELD_DATA),
              parseInt(fields.get(FIELD_ATTEMPTS_MADE)),
              fields.get(FIELD_FAILED_REASON),
              parseInstant(fields.get(FIELD_FINISHED_AT))));
    }
    return jobs;
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      logger.info("notification queue closed queue={}", name());
    }
  }

  boolean isClosed() {
    return closed.get();
  }

  private FailureOutcome recordFailedAttempt(
      String jobId, int attemptsMade, String errorMessage, Instant now) {
    final Map<String, String> fields = new HashMap<>();
    fields.put(FIELD_ATTEMPTS_MADE, Integer.toString(attemptsMade));
    fields.put(FIELD_FAILED_REASON, truncateError(errorMessage));

    final RetryPolicy retryPolicy = settings.retryPolicy();
    if (retryPolicy.shouldRetry(attemptsMade)) {
      final Duration delay = retryPolicy.delayAfter(attemptsMade);
      fields.put(FIELD_STATE, STATE_DELAYED);
      redisTemplate
          .opsForZSet()
          .add(delayedKey(name()), jobId, now.plus(delay).toEpochMilli());
      redisTemplate.opsForHash().putAll(jobKey(name(), jobId), fields);
      return FailureOutcome.retry(attemptsMade, delay);
    }

    deadLetter(jobId, fields, now);
    return FailureOutcome.deadLettered(attemptsMade);
  }

  /**
   * Active entries claimed longer ago than the stalled timeout have no recorded outcome, either
   * because the worker died or because the broker failed while the outcome was written. Each one
   * counts as a failed attempt and follows the retry policy.
   */
  private void recoverStalledJobs(Instant now) {
    final ZSetOperations<String, String> zset = redisTemplate.opsForZSet();
    final long cutoff = now.minus(settings.stalledTimeout()).toEpochMilli();
    final Set<String> stalled = zset.rangeByScore(activeKey(name()), 0, cutoff);
    if (stalled == null || stalled.isEmpty()) {
      return;
    }
    for (String jobId : stalled) {
      // another worker may have recovered the same job
      final Long removed = zset.remove(activeKey(name()), jobId);
      if (removed == null || removed == 0) {
        continue;
      }
      final Map<Object, Object> raw = redisTemplate.opsForHash().entries(jobKey(name(), jobId));
      if (raw.isEmpty()) {
        logger.warn("stalled job record missing queue={} jobId={}", name(), jobId);
        continue;
      }
      final Map<String, String> fields = normalizeFields(raw);
      final String state = fields.get(FIELD_STATE);
      if (STATE_COMPLETED.equals(state) || STATE_FAILED.equals(state)) {
        continue;
      }
      if (STATE_DELAYED.equals(state) && zset.score(delayedKey(name()), jobId) != null) {
        continue;
      }
      final int attemptsMade = parseInt(fields.get(FIELD_ATTEMPTS_MADE)) + 1;
      final FailureOutcome outcome =
          recordFailedAttempt(
              jobId,
              attemptsMade,
              "job stalled: no outcome recorded within " + settings.stalledTimeout(),
              now);
      logger.warn(
          "notification job stalled queue={} jobId={} attemptsMade={} retryScheduled={}",
          name(),
          jobId,
          attemptsMade,
          outcome.retryScheduled());
    }
  }

  private void promoteDueJobs(Instant now) {
    final ZSetOperations<String, String> zset = redisTemplate.opsForZSet();
    final Set<ZSetOperations.TypedTuple<String>> due =
        zset.rangeByScoreWithScores(delayedKey(name()), 0, now.toEpochMilli());
    if (due == null || due.isEmpty()) {
      return;
    }
    for (ZSetOperations.TypedTuple<String> tuple : due) {
      final String jobId = tuple.getValue();
      if (jobId == null) {
        continue;
      }
      // another worker may have promoted the same job
      final Long removed = zset.remove(delayedKey(name()), jobId);
      if (removed == null || removed == 0) {
        continue;
      }
      final Object rawPriority = redisTemplate.opsForHash().get(jobKey(name(), jobId), FIELD_PRIORITY);
      final int priority = parseInt(rawPriority == null ? null : String.valueOf(rawPriority));
      final Double readyAt = tuple.getScore();
      final Instant readyInstant =
          readyAt == null ? now : Instant.ofEpochMilli(readyAt.longValue());
      redisTemplate.opsForHash().put(jobKey(name(), jobId), FIELD_STATE, STATE_WAITING);
      zset.add(waitKey(name()), jobId, waitScore(priority, readyInstant));
    }
  }

  private void deadLetter(String jobId, Map<String, String> fields, Instant now) {
    fields.put(FIELD_STATE, STATE_FAILED);
    fields.put(FIELD_FINISHED_AT, now.toString());
    redisTemplate.opsForHash().putAll(jobKey(name(), jobId), fields);
    redisTemplate.opsForList().leftPush(failedKey(name()), jobId);
    trimFinished(failedKey(name()), settings.retentionPolicy().keepFailed());
  }

  private void trimFinished(String listKey, int keep) {
    final List<String> overflow = redisTemplate.opsForList().range(listKey, keep, -1);
    if (overflow == null || overflow.isEmpty()) {
      return;
    }
    redisTemplate.delete(overflow.stream().map(id -> jobKey(name(), id)).toList());
    if (keep == 0) {
      redisTemplate.delete(listKey);
    } else {
      redisTemplate.opsForList().trim(listKey, 0, keep - 1L);
    }
  }

  private QueuedJob toQueuedJob(String jobId, Map<String, String> fields) {
    return new QueuedJob(
        jobId,
        name(),
        fields.get(FIELD_NAME),
        fields.get(FIELD_DATA),
        parseInt(fields.get(FIELD_PRIORITY)),
        parseInt(fields.get(FIELD_ATTEMPTS_MADE)),
        parseInstant(fields.get(FIELD_ENQUEUED_AT)),
        fields.get(FIELD_TRACE_ID));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    if (message.length() <= errorMessageMaxLength) {
      return message;
    }
    return message.substring(0, errorMessageMaxLength);
  }

  /** Higher priority sorts first; equal priorities keep FIFO order by time. */
  static double waitScore(int priority, Instant at) {
    final int clamped = Math.max(0, Math.min(MAX_PRIORITY, priority));
    return (double) ((MAX_PRIORITY - clamped) * PRIORITY_SPAN + at.toEpochMilli());
  }

  static String jobKey(String queueName, String jobId) {
    return "nq:" + queueName + ":job:" + jobId;
  }

  static String waitKey(String queueName) {
    return "nq:" + queueName + ":wait";
  }

  static String delayedKey(String queueName) {
    return "nq:" + queueName + ":delayed";
  }

  static String activeKey(String queueName) {
    return "nq:" + queueName + ":active";
  }

  static String completedKey(String queueName) {
    return "nq:" + queueName + ":completed";
  }

  static String failedKey(String queueName) {
    return "nq:" + queueName + ":failed";
  }

  private static long orZero(Long value) {
    return value == null ? 0 : value;
  }

  private Map<String, String> normalizeFields(Map<Object, Object> raw) {
    final Map<String, String> map = new HashMap<>();
    for (Map.Entry<Object, Object> e : raw.entrySet()) {
      map.put(
          String.valueOf(e.getKey()), e.getValue() == null ? null : String.valueOf(e.getValue()));
    }
    return map;
  }

  private int parseInt(String value) {
    if (value == null || value.isBlank()) {
      return 0;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      logger.warn("unparseable integer field queue={} value={}", name(), value);
      return 0;
    }
  }

  private Instant parseInstant(String value) {
    return value == null || value.isBlank() ? null : Instant.parse(value);
  }
}
