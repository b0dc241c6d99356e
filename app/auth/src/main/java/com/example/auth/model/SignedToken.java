package com.example.auth.model;

/** Opaque signed session token. Its lifetime and format belong to the signer. */
public record SignedToken(String value) {

  @Override
  public String toString() {
    return "SignedToken[***]";
  }
}
