/*
 * どこで: Commitment サービス層
 * 何を: プラン種別からティアと最大コミットメント日数を決める
 * なぜ: 上限判定を I/O なしの純粋関数に閉じ込め、未知の値を最も厳しい側へ倒すため
 */
package com.example.commitment.service;

import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class CommitmentPolicy {

  public static final String DEFAULT_TIER = "1month";

  private static final Map<String, String> PLAN_TO_TIER =
      Map.of(
          "monthly", "1month",
          "3months", "3month",
          "3month", "3month",
          "yearly", "1year",
          "annual", "1year",
          "1year", "1year");

  private static final Map<String, TierLimits> TIER_LIMITS =
      Map.of(
          "1month", new TierLimits("1month", 30, "Monthly", true),
          "3month", new TierLimits("3month", 90, "3-Month", true),
          "1year", new TierLimits("1year", 365, "Annual", true));

  private static final TierLimits NO_SUBSCRIPTION = new TierLimits("none", 0, "none", false);

  public String tierForPlan(String planType) {
    if (planType == null) {
      return DEFAULT_TIER;
    }
    return PLAN_TO_TIER.getOrDefault(planType.trim().toLowerCase(Locale.ROOT), DEFAULT_TIER);
  }

  public TierLimits limitsForTier(String tier) {
    final TierLimits limits = tier == null ? null : TIER_LIMITS.get(tier);
    return limits == null ? TIER_LIMITS.get(DEFAULT_TIER) : limits;
  }

  public TierLimits limitsForPlan(String planType) {
    return limitsForTier(tierForPlan(planType));
  }

  public TierLimits noSubscription() {
    return NO_SUBSCRIPTION;
  }

  public boolean isWithinLimit(int durationDays, TierLimits limits) {
    return durationDays >= 1 && durationDays <= limits.maxDays();
  }

  public record TierLimits(String tier, int maxDays, String label, boolean hasSubscription) {}
}
