package com.example.auth.service;

import com.example.auth.model.SessionClaims;
import com.example.auth.model.SignedToken;

public interface TokenSigner {

  SignedToken sign(SessionClaims claims);
}
