package com.linechat.service;

/**
 * The user file cannot be read, parsed or written.
 */
public class CredentialStoreException extends RuntimeException {
  public CredentialStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
