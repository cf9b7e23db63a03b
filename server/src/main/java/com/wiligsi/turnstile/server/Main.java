package com.wiligsi.turnstile.server;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * The entry point for the Turnstile lock state server. This will run a server until it crashes or
 * is interrupted. Workers point a "remote" lock store endpoint at it to share their locks.
 *
 * @author Steven Miller
 */
@Command(name = "turnstile-server", version = "turnstile 1.0",
    description = "runs a server that shares conversation lock state between workers",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {

  @Option(names = {"-p", "--port"}, description = "The port number the server should run on")
  protected int serverPort = TurnstileServer.DEFAULT_PORT;

  @Option(names = {"-s", "--sweep-interval"},
      description = "Seconds between removals of locks nobody is waiting on")
  protected long sweepIntervalSeconds = TurnstileServer.DEFAULT_SWEEP_INTERVAL.getSeconds();

  @Override
  public Integer call() throws IOException, InterruptedException {
    if (serverPort < 0 || sweepIntervalSeconds < 1) {
      System.err.printf(
          "Port must not be negative and the sweep interval must be at least 1 second%n"
      );
      return -1;
    }

    System.out.printf(
        "Starting server on port '%d' sweeping every %d seconds%n",
        serverPort, sweepIntervalSeconds
    );
    final TurnstileServer server = new TurnstileServer(
        serverPort,
        Duration.ofSeconds(sweepIntervalSeconds),
        new LockStateServiceImpl()
    );

    server.start();
    server.blockUntilShutdown();

    return 0;
  }

  /**
   * The entry point for running the server.
   *
   * @param args - the command line arguments passed to the server
   */
  public static void main(String[] args) {
    final int code = new CommandLine(new Main()).execute(args);
    System.exit(code);
  }
}
