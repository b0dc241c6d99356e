package com.example.auth.model;

/**
 * Addresses a user row either by its access token hash or by its provider identity, never both.
 */
public record UserFilter(AuthProvider provider, String thirdPartyId, String accessTokenHash) {

  public UserFilter {
    final boolean byHash = accessTokenHash != null;
    final boolean byIdentity = provider != null || thirdPartyId != null;
    if (byHash == byIdentity) {
      throw new IllegalArgumentException(
          "filter must address a user by accessTokenHash or by provider and thirdPartyId");
    }
    if (byIdentity && (provider == null || thirdPartyId == null)) {
      throw new IllegalArgumentException("provider and thirdPartyId must be given together");
    }
  }

  public static UserFilter byAccessTokenHash(String accessTokenHash) {
    return new UserFilter(null, null, accessTokenHash);
  }

  public static UserFilter byIdentity(ProviderIdentity identity) {
    return new UserFilter(identity.provider(), identity.thirdPartyId(), null);
  }

  public boolean addressesAccessTokenHash() {
    return accessTokenHash != null;
  }
}
