package com.rabbitresilience.core.application;

import com.rabbitresilience.core.domain.PublishOptions;

public final class PriorityMapper {
  public static final int HIGH_PRIORITY = 5;

  private PriorityMapper() {}

  // an explicit priority wins over the high-priority flag
  public static Integer map(PublishOptions options) {
    if (options.priority() != null) return options.priority();
    return options.highPriority() ? HIGH_PRIORITY : null;
  }
}
