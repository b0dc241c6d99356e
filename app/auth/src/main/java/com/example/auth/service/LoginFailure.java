package com.example.auth.service;

public enum LoginFailure {
  /** The anonymous access token does not belong to any user. */
  UNAUTHENTICATED,
  /** The provider identity is unknown and self registration is closed. */
  SIGNUP_DISABLED
}
