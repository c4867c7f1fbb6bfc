package dev.henneberger.vertx.changefeed.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed reconnect delays keyed by what caused the reconnect. A primary election gets a short delay so the feed
 * catches up quickly once the new primary settles; everything else waits longer to give the server time to recover.
 * There is no backoff growth and no attempt limit.
 */
public final class ReconnectPolicy {

  public static final Duration DEFAULT_ELECTION_DELAY = Duration.ofSeconds(1);
  public static final Duration DEFAULT_RECOVERY_DELAY = Duration.ofSeconds(5);

  private Duration electionDelay = DEFAULT_ELECTION_DELAY;
  private Duration recoveryDelay = DEFAULT_RECOVERY_DELAY;

  private ReconnectPolicy() {
  }

  public static ReconnectPolicy fixedDelays() {
    return new ReconnectPolicy();
  }

  public static ReconnectPolicy fixedDelays(Duration electionDelay, Duration recoveryDelay) {
    return new ReconnectPolicy()
      .setElectionDelay(electionDelay)
      .setRecoveryDelay(recoveryDelay);
  }

  public ReconnectPolicy copy() {
    ReconnectPolicy copy = new ReconnectPolicy();
    copy.electionDelay = electionDelay;
    copy.recoveryDelay = recoveryDelay;
    return copy;
  }

  public ReconnectPolicy setElectionDelay(Duration electionDelay) {
    this.electionDelay = Objects.requireNonNull(electionDelay, "electionDelay");
    return this;
  }

  public ReconnectPolicy setRecoveryDelay(Duration recoveryDelay) {
    this.recoveryDelay = Objects.requireNonNull(recoveryDelay, "recoveryDelay");
    return this;
  }

  public Duration getElectionDelay() {
    return electionDelay;
  }

  public Duration getRecoveryDelay() {
    return recoveryDelay;
  }

  public Duration delayFor(ReconnectTrigger trigger) {
    Objects.requireNonNull(trigger, "trigger");
    return trigger == ReconnectTrigger.SERVER_ELECTION ? electionDelay : recoveryDelay;
  }

  public void validate() {
    if (electionDelay.isNegative()) {
      throw new IllegalArgumentException("electionDelay must be >= 0");
    }
    if (recoveryDelay.isNegative()) {
      throw new IllegalArgumentException("recoveryDelay must be >= 0");
    }
    if (recoveryDelay.compareTo(electionDelay) < 0) {
      throw new IllegalArgumentException("recoveryDelay must be >= electionDelay");
    }
  }
}
