package com.teamplatform.common.retry;

/** 例外に付与すると、既定の判定で再試行されなくなる。 */
public interface NonRetryableFailure {}
