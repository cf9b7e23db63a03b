package com.wiligsi.turnstile.server;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * This is the class that takes the LockStateServiceImpl class and runs it, together with the
 * periodic sweep of idle locks.
 *
 * @author Steven Miller
 */
public class TurnstileServer {

  static final int DEFAULT_PORT = 50051;
  static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);
  private static final Logger LOG = Logger.getLogger(TurnstileServer.class.getName());

  private Server server;
  private ScheduledExecutorService sweeper;
  private final int port;
  private final Duration sweepInterval;
  private final LockStateServiceImpl service;

  /**
   * Constructs a new server on the default port.
   */
  public TurnstileServer() {
    this(DEFAULT_PORT, DEFAULT_SWEEP_INTERVAL, new LockStateServiceImpl());
  }

  /**
   * Constructs a new server given a port number.
   *
   * @param port          - the port number to run the server on, 0 for any free port
   * @param sweepInterval - how often idle locks are removed
   * @param service       - the service holding the lock state
   */
  public TurnstileServer(int port, Duration sweepInterval, LockStateServiceImpl service) {
    this.port = port;
    this.sweepInterval = sweepInterval;
    this.service = service;
  }

  /**
   * Start the server.
   *
   * @throws IOException if the server fails to run
   */
  public void start() throws IOException {
    server = ServerBuilder.forPort(port)
        .addService(service)
        .build()
        .start();
    LOG.info("Server started, listening on port: " + server.getPort());

    sweeper = Executors.newSingleThreadScheduledExecutor();
    sweeper.scheduleWithFixedDelay(
        this::sweep,
        sweepInterval.toMillis(),
        sweepInterval.toMillis(),
        TimeUnit.MILLISECONDS
    );

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      System.err.println("shutting down gRPC with the JVM");
      try {
        TurnstileServer.this.stop();
      } catch (InterruptedException exception) {
        System.err.println("Error shutting down grpc");
        exception.printStackTrace(System.err);
      }

      System.err.println("gRPC server shut down");
    }));
  }

  /**
   * Stop accepting requests and wait for running ones to finish.
   *
   * @throws InterruptedException if the shutdown is interrupted
   */
  public void stop() throws InterruptedException {
    if (sweeper != null) {
      sweeper.shutdownNow();
    }
    if (server != null) {
      server.shutdown().awaitTermination(30, TimeUnit.SECONDS);
    }
  }

  /**
   * Block the calling thread until the server is shut down.
   *
   * @throws InterruptedException if the wait is interrupted
   */
  public void blockUntilShutdown() throws InterruptedException {
    if (server != null) {
      server.awaitTermination();
    }
  }

  /**
   * The port the server listens on once started.
   *
   * @return the bound port, or the configured port if the server isn't running
   */
  public int getPort() {
    return server == null ? port : server.getPort();
  }

  public LockStateServiceImpl getService() {
    return service;
  }

  private void sweep() {
    try {
      service.sweepExpired();
    } catch (RuntimeException sweepException) {
      LOG.log(Level.SEVERE, "Sweeping idle locks failed", sweepException);
    }
  }
}
