package com.teamplatform.provisioning.actor;

import com.teamplatform.common.retry.NonRetryableFailure;

public class ProvisioningConflictException extends RuntimeException implements NonRetryableFailure {

  public ProvisioningConflictException(String message) {
    super(message);
  }
}
