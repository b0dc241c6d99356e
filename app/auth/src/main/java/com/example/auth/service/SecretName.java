package com.example.auth.service;

public enum SecretName {
  ACCESS_TOKEN_SALT,
  JWT_SECRET_KEY
}
