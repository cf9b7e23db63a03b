package com.wiligsi.turnstile.core.config;

import com.wiligsi.turnstile.core.store.LockStore;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Decides how many worker processes may handle messages. More than one worker is only safe when
 * every worker sees the same lock state, so a process-local store always gets one worker.
 *
 * @author Steven Miller
 */
public class WorkerPolicy {

  public static final String WORKERS_ENV = "TURNSTILE_WORKERS";
  public static final int DEFAULT_WORKERS = 1;

  private static final Logger LOG = Logger.getLogger(WorkerPolicy.class.getName());

  private WorkerPolicy() {
  }

  /**
   * Get the number of workers to start.
   *
   * @param store       - the lock store the workers will share
   * @param environment - usually {@code System.getenv()}
   * @return the requested worker count if the store allows it, otherwise {@value #DEFAULT_WORKERS}
   */
  public static int numberOfWorkers(LockStore store, Map<String, String> environment) {
    final String rawWorkers = environment.get(WORKERS_ENV);
    if (rawWorkers == null || rawWorkers.isBlank()) {
      return defaultWorkers();
    }

    final int requested;
    try {
      requested = Integer.parseInt(rawWorkers.trim());
    } catch (NumberFormatException formatException) {
      LOG.severe(
          String.format("Cannot convert %s='%s' to a number", WORKERS_ENV, rawWorkers)
      );
      return defaultWorkers();
    }

    if (requested == DEFAULT_WORKERS) {
      return defaultWorkers();
    }

    if (requested < 1) {
      LOG.fine(
          String.format(
              "Cannot use %d workers. The number of workers must be at least 1", requested
          )
      );
      return defaultWorkers();
    }

    if (store != null && store.isSharedAcrossProcesses()) {
      LOG.fine(String.format("Using %d workers", requested));
      return requested;
    }

    LOG.fine(
        String.format(
            "Unable to use %d workers because the lock store is not shared across processes",
            requested
        )
    );
    return defaultWorkers();
  }

  private static int defaultWorkers() {
    LOG.fine(String.format("Using the default number of workers (%d)", DEFAULT_WORKERS));
    return DEFAULT_WORKERS;
  }
}
