/*
 * どこで: Commitment アプリの設定バインド
 * 何を: 期限スイープの間隔/初回遅延/警告ウィンドウ設定を保持する
 * なぜ: 運用パラメータを外部化し、テストで短い値に差し替えるため
 */
package com.example.commitment.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "commitment.sweeper")
public record CommitmentSweeperProperties(
    boolean enabled,
    @NotNull Duration interval,
    @NotNull Duration initialDelay,
    @NotNull Duration warningWindow,
    @NotNull Duration pendingTimeout) {}
