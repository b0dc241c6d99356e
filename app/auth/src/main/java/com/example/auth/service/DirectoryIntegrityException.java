package com.example.auth.service;

/** A lookup by a unique key returned more than one user. */
public class DirectoryIntegrityException extends RuntimeException {

  private final int matchCount;

  public DirectoryIntegrityException(String message, int matchCount) {
    super(message);
    this.matchCount = matchCount;
  }

  public int matchCount() {
    return matchCount;
  }
}
