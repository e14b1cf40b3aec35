package com.example.credentialrotator.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.example.credentialrotator.core.policy.CredentialPolicy;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps policies reconciled on a schedule.
 *
 * <p>Each policy key ({@code name.namespace}) has at most one reconcile running at any time; the
 * next one is scheduled from the result of the previous. Registering a policy again replaces its
 * definition and triggers an immediate reconcile.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * var scheduler = new RotationScheduler(new CredentialRotationService(factory), 4);
 * scheduler.schedule(policy);
 * ...
 * scheduler.shutdown();
 * }</pre>
 */
public class RotationScheduler implements AutoCloseable {

  private static final System.Logger logger = System.getLogger(RotationScheduler.class.getName());

  private final CredentialRotationService service;
  private final ScheduledExecutorService executor;
  private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
  private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();
  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  public RotationScheduler(final CredentialRotationService service, final int threads) {
    this.service = Objects.requireNonNull(service, "service must not be null");
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1");
    }
    final var counter = new AtomicInteger();
    this.executor =
        Executors.newScheduledThreadPool(
            threads,
            r -> {
              final var t = new Thread(r, "RotationScheduler-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * Registers or replaces a policy and reconciles it right away.
   *
   * @param policy policy to keep rotated
   */
  public void schedule(final CredentialPolicy policy) {
    final var key = policy.key();
    final var registration = new Registration(policy);
    synchronized (this) {
      registrations.put(key, registration);
      reschedule(key, registration, Duration.ZERO);
    }
    logger.log(INFO, "Scheduling credential policy {0}", key);
  }

  /**
   * Stops reconciling a policy. A reconcile already running completes.
   *
   * @param key policy key, {@code name.namespace}
   */
  public void unschedule(final String key) {
    synchronized (this) {
      registrations.remove(key);
      final var future = pending.remove(key);
      if (future != null) {
        future.cancel(false);
      }
    }
    final var lock = locks.get(key);
    if (lock != null && lock.tryLock()) {
      try {
        releaseLockIfUnscheduled(key, lock);
      } finally {
        lock.unlock();
      }
    }
    logger.log(INFO, "Unscheduled credential policy {0}", key);
  }

  /** Whether a policy is registered. */
  public boolean isScheduled(final String key) {
    return registrations.containsKey(key);
  }

  boolean hasLock(final String key) {
    return locks.containsKey(key);
  }

  // callers hold the monitor of this scheduler
  private void reschedule(final String key, final Registration registration, final Duration delay) {
    if (executor.isShutdown()) {
      return;
    }
    final var future =
        executor.schedule(
            () -> run(key, registration),
            Math.max(0L, delay.toMillis()),
            TimeUnit.MILLISECONDS);
    final var previous = pending.put(key, future);
    if (previous != null) {
      previous.cancel(false);
    }
  }

  private void run(final String key, final Registration registration) {
    final var lock = acquire(key);
    try {
      if (registrations.get(key) != registration) {
        // replaced or removed before this run started
        return;
      }
      Optional<Duration> next;
      try {
        next = service.reconcile(registration.policy()).requeue();
      } catch (final RuntimeException e) {
        logger.log(ERROR, "Unexpected failure reconciling " + key, e);
        next = Optional.of(CredentialRotationService.RETRY_DELAY);
      }
      final var requeue = next;
      synchronized (this) {
        if (registrations.get(key) != registration) {
          return;
        }
        requeue.ifPresentOrElse(
            delay -> {
              logger.log(DEBUG, "Next reconcile of {0} in {1}", key, delay);
              reschedule(key, registration, delay);
            },
            () -> pending.remove(key));
      }
    } finally {
      releaseLockIfUnscheduled(key, lock);
      lock.unlock();
    }
  }

  /** Locks the current lock of a key; a lock dropped while waiting for it is not used. */
  private ReentrantLock acquire(final String key) {
    while (true) {
      final var lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
      lock.lock();
      if (locks.get(key) == lock) {
        return lock;
      }
      lock.unlock();
    }
  }

  // callers hold the lock
  private void releaseLockIfUnscheduled(final String key, final ReentrantLock lock) {
    if (!registrations.containsKey(key)) {
      locks.remove(key, lock);
    }
  }

  /** Stops the scheduler, waiting briefly for running reconciles. */
  public void shutdown() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
    } catch (final InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    pending.clear();
  }

  @Override
  public void close() {
    shutdown();
  }

  /** One registration of a policy; a new instance per {@link #schedule} call. */
  private record Registration(CredentialPolicy policy) {}
}
