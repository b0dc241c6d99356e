package com.example.auth.service;

import com.example.auth.model.SignedToken;

/**
 * Outcome of a login validation. Policy rejections are values; collaborator faults are thrown.
 */
public sealed interface LoginResult permits LoginResult.Issued, LoginResult.Rejected {

  static LoginResult issued(SignedToken token, String userId, boolean userCreated) {
    return new Issued(token, userId, userCreated);
  }

  static LoginResult rejected(LoginFailure failure, String message) {
    return new Rejected(failure, message);
  }

  record Issued(SignedToken token, String userId, boolean userCreated) implements LoginResult {}

  record Rejected(LoginFailure failure, String message) implements LoginResult {}
}
