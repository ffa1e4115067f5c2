/*
 * どこで: Commitment サービス層
 * 何を: アプリ起動時に期限スイープを定期実行へ登録し、停止時に解除する
 * なぜ: スイープの開始/停止をアプリのライフサイクルと揃えるため
 */
package com.example.commitment.service;

import com.example.commitment.api.response.CommitmentStatsResponse;
import com.example.commitment.config.CommitmentSweeperProperties;
import com.example.commitment.repository.CommitmentRepository;
import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

@Component
public class ExpirySweepScheduler implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(ExpirySweepScheduler.class);

  private final CommitmentExpirySweeper sweeper;
  private final SweepTrigger trigger;
  private final CommitmentRepository commitmentRepository;
  private final CommitmentSweeperProperties properties;
  private volatile boolean running;

  public ExpirySweepScheduler(
      CommitmentExpirySweeper sweeper,
      SweepTrigger trigger,
      CommitmentRepository commitmentRepository,
      CommitmentSweeperProperties properties) {
    this.sweeper = sweeper;
    this.trigger = trigger;
    this.commitmentRepository = commitmentRepository;
    this.properties = properties;
  }

  @Override
  public void start() {
    if (running) {
      return;
    }
    if (!properties.enabled()) {
      logger.info("expiry sweeper disabled");
      running = true;
      return;
    }
    trigger.scheduleAtFixedRate(
        this::runSweep, properties.initialDelay(), properties.interval());
    logger.info(
        "expiry sweeper started interval={} initialDelay={} warningWindow={}",
        properties.interval(),
        properties.initialDelay(),
        properties.warningWindow());
    running = true;
  }

  @Override
  public void stop() {
    if (!running) {
      return;
    }
    trigger.close();
    logger.info("expiry sweeper stopped");
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  public CommitmentStatsResponse getStats() {
    final List<CommitmentStatsResponse.StatusStat> byStatus =
        commitmentRepository.countByStatus().stream()
            .map(
                count ->
                    new CommitmentStatsResponse.StatusStat(
                        count.status().name(), count.count(), count.averageDays()))
            .toList();
    return new CommitmentStatsResponse(
        byStatus, sweeper.lastRunAt().map(Object::toString).orElse(null));
  }

  @VisibleForTesting
  void runSweep() {
    try {
      sweeper.sweep();
    } catch (RuntimeException ex) {
      // スケジューラへ例外を返すと以降の定期実行が止まる
      logger.error("expiry sweep aborted unexpectedly", ex);
    }
  }
}
