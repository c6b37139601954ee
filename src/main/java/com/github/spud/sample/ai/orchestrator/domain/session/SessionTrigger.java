package com.github.spud.sample.ai.orchestrator.domain.session;

/**
 * 会话状态机事件
 */
public enum SessionTrigger {
  START,
  SUCCEED,
  FLAG_FOR_REVIEW,
  FAIL,
  CANCEL
}
