package com.teamplatform.provisioning.actor;

public enum FailureKind {
  TRANSIENT,
  PERMANENT
}
