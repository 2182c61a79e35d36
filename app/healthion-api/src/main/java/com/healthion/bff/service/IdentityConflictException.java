package com.healthion.bff.service;

public class IdentityConflictException extends RuntimeException {

  public IdentityConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}
