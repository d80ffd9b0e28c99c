package com.teamplatform.provisioning.actor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

/** ステップ単位の実行記録。attempts は直近の実行で外部呼び出しを試みた回数。 */
public record StepCheckpoint(
    Status status, Instant startedAt, Instant completedAt, String error, int attempts) {

  public enum Status {
    RUNNING,
    COMPLETED,
    FAILED
  }

  @JsonIgnore
  public boolean isCompleted() {
    return status == Status.COMPLETED;
  }
}
