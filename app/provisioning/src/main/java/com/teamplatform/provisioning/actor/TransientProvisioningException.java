package com.teamplatform.provisioning.actor;

public class TransientProvisioningException extends RuntimeException {

  public TransientProvisioningException(String message) {
    super(message);
  }

  public TransientProvisioningException(String message, Throwable cause) {
    super(message, cause);
  }
}
