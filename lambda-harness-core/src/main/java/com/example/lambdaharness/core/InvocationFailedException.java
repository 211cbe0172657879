package com.example.lambdaharness.core;

/**
 * Unchecked carrier for a checked failure of the user work, used where the caller's signature
 * cannot declare it.
 */
public class InvocationFailedException extends RuntimeException {

  public InvocationFailedException(final Throwable cause) {
    super(cause.getMessage(), cause);
  }
}
