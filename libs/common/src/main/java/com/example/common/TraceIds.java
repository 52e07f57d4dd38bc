package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** Runs {@code action} with a fresh trace id in the MDC, restoring the previous value after. */
  public static void runTraced(Runnable action) {
    final String previous = MDC.get(MDC_KEY);
    MDC.put(MDC_KEY, newTraceId());
    try {
      action.run();
    } finally {
      if (previous == null) {
        MDC.remove(MDC_KEY);
      } else {
        MDC.put(MDC_KEY, previous);
      }
    }
  }
}
