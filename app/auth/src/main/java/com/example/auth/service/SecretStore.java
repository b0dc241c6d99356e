package com.example.auth.service;

/** Source of configured salts and signing secrets. */
public interface SecretStore {

  /**
   * Returns the configured value.
   *
   * @throws IllegalStateException when the secret is not configured
   */
  String get(SecretName name);
}
