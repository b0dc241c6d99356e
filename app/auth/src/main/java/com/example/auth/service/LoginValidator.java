package com.example.auth.service;

import com.example.auth.model.AuthProvider;
import com.example.auth.model.LoginCredential;
import com.example.auth.model.ProviderIdentity;
import com.example.auth.model.SessionClaims;
import com.example.auth.model.SignedToken;
import com.example.auth.model.UserFilter;
import com.example.auth.model.UserRecord;
import java.util.List;
import java.util.Optional;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether a session may be established for a credential and issues the signed session
 * token.
 *
 * <p>Anonymous access tokens only resolve users that already exist. Provider identities may
 * provision a new user when {@link SignupPolicy} allows it. Each call is stateless and runs its
 * collaborator calls sequentially; collaborator exceptions propagate unchanged.
 */
@Service
@RequiredArgsConstructor
public class LoginValidator {

  private static final Logger logger = LoggerFactory.getLogger(LoginValidator.class);

  private final SecretStore secretStore;
  private final UserDirectory userDirectory;
  private final SignupPolicy signupPolicy;
  private final TokenSigner tokenSigner;
  private final AccessTokenHasher accessTokenHasher;
  private final LoginMetrics loginMetrics;

  public LoginResult validate(@NonNull LoginCredential credential) {
    if (credential instanceof LoginCredential.Anonymous anonymous) {
      return validateAnonymousLogin(anonymous.rawToken());
    }
    if (credential instanceof LoginCredential.FederatedIdentity federated) {
      return validateInternetIdentityLogin(federated.principalId());
    }
    final LoginCredential.OAuth oauth = (LoginCredential.OAuth) credential;
    return validateOAuthLogin(oauth.identity());
  }

  public LoginResult validateAnonymousLogin(String rawToken) {
    if (isBlank(rawToken)) {
      throw new IllegalArgumentException("accessToken is required");
    }
    final String salt = secretStore.get(SecretName.ACCESS_TOKEN_SALT);
    final String hashedToken = accessTokenHasher.deriveAccessToken(rawToken, salt);

    final Optional<UserRecord> user =
        findUnique(UserFilter.byAccessTokenHash(hashedToken), LoginMethod.ANONYMOUS);
    if (user.isEmpty()) {
      logger.info("anonymous login rejected: access token does not match any user");
      loginMetrics.recordRejected(LoginMethod.ANONYMOUS, LoginFailure.UNAUTHENTICATED);
      return LoginResult.rejected(LoginFailure.UNAUTHENTICATED, "access token is invalid");
    }
    return issue(LoginMethod.ANONYMOUS, user.get(), false);
  }

  public LoginResult validateInternetIdentityLogin(String principalId) {
    if (isBlank(principalId)) {
      throw new IllegalArgumentException("principalId is required");
    }
    return validateProviderLogin(
        LoginMethod.INTERNET_IDENTITY,
        new ProviderIdentity(AuthProvider.INTERNET_IDENTITY, principalId));
  }

  public LoginResult validateOAuthLogin(@NonNull ProviderIdentity identity) {
    if (identity.provider() == null) {
      throw new IllegalArgumentException("provider is required");
    }
    if (identity.provider() == AuthProvider.ANONYMOUS) {
      throw new IllegalArgumentException("ANONYMOUS is not an identity provider");
    }
    if (isBlank(identity.thirdPartyId())) {
      throw new IllegalArgumentException("thirdPartyId is required");
    }
    return validateProviderLogin(LoginMethod.OAUTH, identity);
  }

  private LoginResult validateProviderLogin(LoginMethod method, ProviderIdentity identity) {
    final Optional<UserRecord> existing = findUnique(UserFilter.byIdentity(identity), method);
    if (existing.isPresent()) {
      return issue(method, existing.get(), false);
    }

    if (!signupPolicy.isSignupEnabled()) {
      logger.info(
          "{} login rejected: no user for provider={} and signup is disabled",
          method.tagValue(),
          identity.provider());
      loginMetrics.recordRejected(method, LoginFailure.SIGNUP_DISABLED);
      return LoginResult.rejected(LoginFailure.SIGNUP_DISABLED, "user signup is disabled");
    }

    final UserRecord created = userDirectory.create(identity);
    logger.info(
        "{} login provisioned user userId={} provider={}",
        method.tagValue(),
        created.id(),
        identity.provider());
    loginMetrics.recordUserProvisioned(identity.provider());
    return issue(method, created, true);
  }

  private Optional<UserRecord> findUnique(UserFilter filter, LoginMethod method) {
    final List<UserRecord> matches = userDirectory.find(filter);
    if (matches.size() > 1) {
      logger.error(
          "{} login aborted: unique lookup returned {} users", method.tagValue(), matches.size());
      throw new DirectoryIntegrityException(
          "user lookup by unique key returned multiple users", matches.size());
    }
    return matches.stream().findFirst();
  }

  private LoginResult issue(LoginMethod method, UserRecord user, boolean userCreated) {
    final SignedToken token = tokenSigner.sign(new SessionClaims(user.id()));
    logger.debug("{} login issued token for userId={}", method.tagValue(), user.id());
    loginMetrics.recordIssued(method);
    return LoginResult.issued(token, user.id(), userCreated);
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
