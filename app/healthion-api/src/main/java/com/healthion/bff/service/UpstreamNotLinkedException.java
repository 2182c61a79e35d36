package com.healthion.bff.service;

public class UpstreamNotLinkedException extends RuntimeException {

  public UpstreamNotLinkedException(String userId) {
    super("user " + userId + " is not registered with the wearables platform");
  }
}
