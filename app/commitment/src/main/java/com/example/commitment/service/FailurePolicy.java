/*
 * どこで: Commitment サービス層
 * 何を: 外部呼び出し箇所ごとの失敗時アクションを表で定義する
 * なぜ: ロールバック/継続/次回再試行の判断を一箇所で読めるようにするため
 */
package com.example.commitment.service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class FailurePolicy {

  private static final Map<CallSite, FailureAction> TABLE = buildTable();

  public FailureAction actionFor(CallSite site) {
    final FailureAction action = TABLE.get(site);
    if (action == null) {
      throw new IllegalStateException("no failure policy for call site: " + site);
    }
    return action;
  }

  private static Map<CallSite, FailureAction> buildTable() {
    final EnumMap<CallSite, FailureAction> table = new EnumMap<>(CallSite.class);
    table.put(CallSite.CREATE_PROFILE, FailureAction.ABORT_AND_ROLLBACK);
    table.put(CallSite.DEPLOY_PROFILE, FailureAction.ABORT_AND_ROLLBACK);
    // 削除 API は冪等とは限らないため、同じスイープ内で自動再試行しない
    table.put(CallSite.REMOVE_ON_ROLLBACK, FailureAction.LOG_AND_CONTINUE);
    table.put(CallSite.REMOVE_ON_EXPIRY, FailureAction.LOG_AND_CONTINUE);
    table.put(CallSite.REMOVE_ON_MANUAL_TERMINATE, FailureAction.LOG_AND_CONTINUE);
    table.put(CallSite.DEVICE_STATUS, FailureAction.LOG_AND_CONTINUE);
    // 完了通知は一度きり。状態は既に終端なので次回スイープでは拾われない
    table.put(CallSite.NOTIFY_COMPLETION, FailureAction.LOG_AND_CONTINUE);
    table.put(CallSite.NOTIFY_WARNING, FailureAction.RETRY_NEXT_SWEEP);
    return Collections.unmodifiableMap(table);
  }
}
