package io.cloudburst.burst.ports;

/**
 * Monotonic time source, in nanoseconds, for measuring elapsed time between cycles.
 */
@FunctionalInterface
public interface Ticker {

  long nanoTime();

  static Ticker system() {
    return System::nanoTime;
  }
}
