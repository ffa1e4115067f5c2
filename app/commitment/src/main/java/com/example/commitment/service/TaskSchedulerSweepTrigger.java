/*
 * どこで: Commitment サービス層
 * 何を: Spring の TaskScheduler で SweepTrigger を実装する
 * なぜ: 本番は Boot 管理のスケジューラスレッドでスイープを回すため
 */
package com.example.commitment.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TaskSchedulerSweepTrigger implements SweepTrigger {

  private final TaskScheduler taskScheduler;
  private final Clock clock;
  private final List<ScheduledFuture<?>> scheduled = new CopyOnWriteArrayList<>();

  @Override
  public void scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
    final Instant firstRun = Instant.now(clock).plus(initialDelay);
    scheduled.add(taskScheduler.scheduleAtFixedRate(task, firstRun, period));
  }

  @Override
  public void close() {
    for (ScheduledFuture<?> future : scheduled) {
      future.cancel(false);
    }
    scheduled.clear();
  }
}
