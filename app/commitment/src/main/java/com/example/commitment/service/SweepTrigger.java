package com.example.commitment.service;

import java.time.Duration;

/** Periodic trigger for the expiry sweep. */
public interface SweepTrigger extends AutoCloseable {

  void scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

  /** Cancels everything scheduled through this trigger. */
  @Override
  void close();
}
