package io.petfeeder.backend.exception;

/** A table read or write failed. Wraps the underlying SDK error. */
public class StoreException extends RuntimeException {

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }

  public StoreException(String message) {
    super(message);
  }
}
