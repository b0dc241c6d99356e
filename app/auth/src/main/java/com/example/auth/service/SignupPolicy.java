package com.example.auth.service;

public interface SignupPolicy {

  /** Whether unseen provider identities may be provisioned as new users at login time. */
  boolean isSignupEnabled();
}
