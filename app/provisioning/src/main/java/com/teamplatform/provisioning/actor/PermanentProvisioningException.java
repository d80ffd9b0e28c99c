package com.teamplatform.provisioning.actor;

import com.teamplatform.common.retry.NonRetryableFailure;

public class PermanentProvisioningException extends RuntimeException
    implements NonRetryableFailure {

  public PermanentProvisioningException(String message) {
    super(message);
  }

  public PermanentProvisioningException(String message, Throwable cause) {
    super(message, cause);
  }
}
