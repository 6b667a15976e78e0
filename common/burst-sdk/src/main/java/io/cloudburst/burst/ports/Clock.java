package io.cloudburst.burst.ports;

import java.time.Instant;

/**
 * Pluggable wall clock used for record timestamps and the job-status watermark.
 * <p>
 * Cycle pacing and idle accounting do not read this clock; they use {@link Ticker}, so a
 * simulated clock never distorts measured idle time.
 */
public interface Clock {

  Instant now();

  static Clock system() {
    return Instant::now;
  }
}
