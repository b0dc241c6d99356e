package com.example.auth.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.auth.model.AuthProvider;
import com.example.auth.model.LoginCredential;
import com.example.auth.model.ProviderIdentity;
import com.example.auth.model.SessionClaims;
import com.example.auth.model.SignedToken;
import com.example.auth.model.UserFilter;
import com.example.auth.model.UserRecord;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

@ExtendWith(MockitoExtension.class)
class LoginValidatorTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  @Mock private SecretStore secretStore;
  @Mock private UserDirectory userDirectory;
  @Mock private SignupPolicy signupPolicy;
  @Mock private TokenSigner tokenSigner;
  @Mock private AccessTokenHasher accessTokenHasher;
  @Mock private LoginMetrics loginMetrics;

  private LoginValidator validator;

  @BeforeEach
  void setUp() {
    validator =
        new LoginValidator(
            secretStore, userDirectory, signupPolicy, tokenSigner, accessTokenHasher, loginMetrics);
  }

  @Nested
  class AnonymousLogin {

    @Test
    void returnsTokenForUserOwningTheHashedToken() {
      when(secretStore.get(SecretName.ACCESS_TOKEN_SALT)).thenReturn("salt");
      when(accessTokenHasher.deriveAccessToken("test-token", "salt")).thenReturn("hashed-token");
      when(userDirectory.find(UserFilter.byAccessTokenHash("hashed-token")))
          .thenReturn(List.of(anonymousUser("user-1", "hashed-token")));
      when(tokenSigner.sign(new SessionClaims("user-1"))).thenReturn(new SignedToken("signed-jwt"));

      final LoginResult result = validator.validateAnonymousLogin("test-token");

      assertThat(result).isInstanceOf(LoginResult.Issued.class);
      final LoginResult.Issued issued = (LoginResult.Issued) result;
      assertThat(issued.token().value()).isEqualTo("signed-jwt");
      assertThat(issued.userId()).isEqualTo("user-1");
      assertThat(issued.userCreated()).isFalse();
      verify(accessTokenHasher).deriveAccessToken("test-token", "salt");
      verify(tokenSigner).sign(new SessionClaims("user-1"));
      verify(userDirectory, never()).create(any());
      verify(loginMetrics).recordIssued(LoginMethod.ANONYMOUS);
    }

    @Test
    void rejectsAsUnauthenticatedWhenNoUserMatches() {
      when(secretStore.get(SecretName.ACCESS_TOKEN_SALT)).thenReturn("salt");
      when(accessTokenHasher.deriveAccessToken("token", "salt")).thenReturn("unknown-hash");
      when(userDirectory.find(UserFilter.byAccessTokenHash("unknown-hash"))).thenReturn(List.of());

      final LoginResult result = validator.validateAnonymousLogin("token");

      assertThat(result)
          .isEqualTo(
              LoginResult.rejected(LoginFailure.UNAUTHENTICATED, "access token is invalid"));
      verify(userDirectory, never()).create(any());
      verifyNoInteractions(signupPolicy, tokenSigner);
      verify(loginMetrics).recordRejected(LoginMethod.ANONYMOUS, LoginFailure.UNAUTHENTICATED);
    }

    @Test
    void throwsWhenTheHashMatchesMoreThanOneUser() {
      when(secretStore.get(SecretName.ACCESS_TOKEN_SALT)).thenReturn("salt");
      when(accessTokenHasher.deriveAccessToken("token", "salt")).thenReturn("dup-hash");
      when(userDirectory.find(UserFilter.byAccessTokenHash("dup-hash")))
          .thenReturn(
              List.of(anonymousUser("user-1", "dup-hash"), anonymousUser("user-2", "dup-hash")));

      assertThatThrownBy(() -> validator.validateAnonymousLogin("token"))
          .isInstanceOf(DirectoryIntegrityException.class)
          .extracting(ex -> ((DirectoryIntegrityException) ex).matchCount())
          .isEqualTo(2);
      verifyNoInteractions(tokenSigner);
    }

    @Test
    void rejectsBlankTokenBeforeReadingTheSalt() {
      assertThatThrownBy(() -> validator.validateAnonymousLogin(" "))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(secretStore, userDirectory, tokenSigner);
    }

    @Test
    void propagatesSecretStoreFailure() {
      final IllegalStateException failure =
          new IllegalStateException("secret ACCESS_TOKEN_SALT is not configured");
      when(secretStore.get(SecretName.ACCESS_TOKEN_SALT)).thenThrow(failure);

      assertThatThrownBy(() -> validator.validateAnonymousLogin("token")).isSameAs(failure);
      verifyNoInteractions(userDirectory, tokenSigner);
    }

    @Test
    void looksUpTheSameHashForTheSameTokenAndSalt() {
      final LoginValidator realHashing =
          new LoginValidator(
              secretStore,
              userDirectory,
              signupPolicy,
              tokenSigner,
              new AccessTokenHasher(),
              loginMetrics);
      when(secretStore.get(SecretName.ACCESS_TOKEN_SALT)).thenReturn("salt");
      when(userDirectory.find(any(UserFilter.class))).thenReturn(List.of());

      realHashing.validateAnonymousLogin("test-token");
      realHashing.validateAnonymousLogin("test-token");

      final ArgumentCaptor<UserFilter> filters = ArgumentCaptor.forClass(UserFilter.class);
      verify(userDirectory, times(2)).find(filters.capture());
      assertThat(filters.getAllValues().get(0)).isEqualTo(filters.getAllValues().get(1));
      assertThat(filters.getValue().accessTokenHash())
          .isEqualTo(new AccessTokenHasher().deriveAccessToken("test-token", "salt"));
    }
  }

  @Nested
  class InternetIdentityLogin {

    private final ProviderIdentity identity =
        new ProviderIdentity(AuthProvider.INTERNET_IDENTITY, "principal-1");

    @Test
    void createsUserAndReturnsTokenWhenSignupEnabled() {
      when(userDirectory.find(UserFilter.byIdentity(identity))).thenReturn(List.of());
      when(signupPolicy.isSignupEnabled()).thenReturn(true);
      when(userDirectory.create(identity)).thenReturn(providerUser("user-1", identity));
      when(tokenSigner.sign(new SessionClaims("user-1"))).thenReturn(new SignedToken("signed-jwt"));

      final LoginResult result = validator.validateInternetIdentityLogin("principal-1");

      assertThat(result)
          .isEqualTo(LoginResult.issued(new SignedToken("signed-jwt"), "user-1", true));
      final InOrder order = inOrder(userDirectory, signupPolicy, tokenSigner);
      order.verify(userDirectory).find(UserFilter.byIdentity(identity));
      order.verify(signupPolicy).isSignupEnabled();
      order.verify(userDirectory, times(1)).create(identity);
      order.verify(tokenSigner, times(1)).sign(new SessionClaims("user-1"));
      verify(loginMetrics).recordUserProvisioned(AuthProvider.INTERNET_IDENTITY);
      verifyNoInteractions(secretStore, accessTokenHasher);
    }

    @Test
    void returnsTokenForExistingUserWithoutConsultingSignupPolicy() {
      when(userDirectory.find(UserFilter.byIdentity(identity)))
          .thenReturn(List.of(providerUser("user-1", identity)));
      when(tokenSigner.sign(new SessionClaims("user-1"))).thenReturn(new SignedToken("signed-jwt"));

      final LoginResult result = validator.validateInternetIdentityLogin("principal-1");

      assertThat(result)
          .isEqualTo(LoginResult.issued(new SignedToken("signed-jwt"), "user-1", false));
      verify(userDirectory, never()).create(any());
      verifyNoInteractions(signupPolicy);
    }

    @Test
    void rejectsWithSignupDisabledWhenUserMissingAndSignupClosed() {
      when(userDirectory.find(UserFilter.byIdentity(identity))).thenReturn(List.of());
      when(signupPolicy.isSignupEnabled()).thenReturn(false);

      final LoginResult result = validator.validateInternetIdentityLogin("principal-1");

      assertThat(result).isInstanceOf(LoginResult.Rejected.class);
      assertThat(((LoginResult.Rejected) result).failure()).isEqualTo(LoginFailure.SIGNUP_DISABLED);
      verify(userDirectory, never()).create(any());
      verifyNoInteractions(tokenSigner);
      verify(loginMetrics)
          .recordRejected(LoginMethod.INTERNET_IDENTITY, LoginFailure.SIGNUP_DISABLED);
    }

    @Test
    void propagatesCreateFailureWithoutSigning() {
      final DuplicateKeyException conflict = new DuplicateKeyException("dup");
      when(userDirectory.find(UserFilter.byIdentity(identity))).thenReturn(List.of());
      when(signupPolicy.isSignupEnabled()).thenReturn(true);
      when(userDirectory.create(identity)).thenThrow(conflict);

      assertThatThrownBy(() -> validator.validateInternetIdentityLogin("principal-1"))
          .isSameAs(conflict);
      verifyNoInteractions(tokenSigner);
    }

    @Test
    void repeatedLoginSignsIdenticalClaims() {
      when(userDirectory.find(UserFilter.byIdentity(identity)))
          .thenReturn(List.of(providerUser("user-1", identity)));
      when(tokenSigner.sign(any(SessionClaims.class)))
          .thenReturn(new SignedToken("jwt-a"), new SignedToken("jwt-b"));

      validator.validateInternetIdentityLogin("principal-1");
      validator.validateInternetIdentityLogin("principal-1");

      final ArgumentCaptor<SessionClaims> claims = ArgumentCaptor.forClass(SessionClaims.class);
      verify(tokenSigner, times(2)).sign(claims.capture());
      assertThat(claims.getAllValues())
          .containsExactly(new SessionClaims("user-1"), new SessionClaims("user-1"));
    }

    @Test
    void rejectsBlankPrincipal() {
      assertThatThrownBy(() -> validator.validateInternetIdentityLogin(null))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(userDirectory, signupPolicy, tokenSigner);
    }
  }

  @Nested
  class OAuthLogin {

    private final ProviderIdentity identity =
        new ProviderIdentity(AuthProvider.GOOGLE, "google-id");

    @Test
    void createsUserFromTheCredentialVerbatimWhenSignupEnabled() {
      when(userDirectory.find(UserFilter.byIdentity(identity))).thenReturn(List.of());
      when(signupPolicy.isSignupEnabled()).thenReturn(true);
      when(userDirectory.create(identity)).thenReturn(providerUser("user-1", identity));
      when(tokenSigner.sign(new SessionClaims("user-1"))).thenReturn(new SignedToken("signed-jwt"));

      final LoginResult result = validator.validateOAuthLogin(identity);

      assertThat(result)
          .isEqualTo(LoginResult.issued(new SignedToken("signed-jwt"), "user-1", true));
      final ArgumentCaptor<ProviderIdentity> created =
          ArgumentCaptor.forClass(ProviderIdentity.class);
      verify(userDirectory).create(created.capture());
      assertThat(created.getValue()).isEqualTo(identity);
      verify(loginMetrics).recordUserProvisioned(AuthProvider.GOOGLE);
    }

    @Test
    void returnsTokenForExistingUser() {
      when(userDirectory.find(UserFilter.byIdentity(identity)))
          .thenReturn(List.of(providerUser("user-1", identity)));
      when(tokenSigner.sign(new SessionClaims("user-1"))).thenReturn(new SignedToken("signed-jwt"));

      final LoginResult result = validator.validateOAuthLogin(identity);

      assertThat(result)
          .isEqualTo(LoginResult.issued(new SignedToken("signed-jwt"), "user-1", false));
      verify(userDirectory, never()).create(any());
    }

    @Test
    void rejectsWithSignupDisabledWhenUserMissingAndSignupClosed() {
      when(userDirectory.find(UserFilter.byIdentity(identity))).thenReturn(List.of());
      when(signupPolicy.isSignupEnabled()).thenReturn(false);

      final LoginResult result = validator.validateOAuthLogin(identity);

      assertThat(result)
          .isEqualTo(LoginResult.rejected(LoginFailure.SIGNUP_DISABLED, "user signup is disabled"));
      verify(userDirectory, never()).create(any());
      verifyNoInteractions(tokenSigner);
    }

    @Test
    void rejectsAnonymousAsProvider() {
      assertThatThrownBy(
              () ->
                  validator.validateOAuthLogin(
                      new ProviderIdentity(AuthProvider.ANONYMOUS, "someone")))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(userDirectory);
    }

    @Test
    void rejectsMissingProvider() {
      assertThatThrownBy(() -> validator.validateOAuthLogin(new ProviderIdentity(null, "x")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("provider is required");
    }
  }

  @Nested
  class CredentialDispatch {

    @Test
    void routesOAuthCredentialToProviderLookup() {
      final ProviderIdentity identity = new ProviderIdentity(AuthProvider.OIDC, "oidc-sub");
      when(userDirectory.find(UserFilter.byIdentity(identity)))
          .thenReturn(List.of(providerUser("user-7", identity)));
      when(tokenSigner.sign(new SessionClaims("user-7"))).thenReturn(new SignedToken("jwt"));

      final LoginResult result =
          validator.validate(new LoginCredential.OAuth(AuthProvider.OIDC, "oidc-sub"));

      assertThat(result).isEqualTo(LoginResult.issued(new SignedToken("jwt"), "user-7", false));
      verify(loginMetrics).recordIssued(LoginMethod.OAUTH);
    }

    @Test
    void routesFederatedIdentityToInternetIdentityProvider() {
      final ProviderIdentity identity =
          new ProviderIdentity(AuthProvider.INTERNET_IDENTITY, "principal-9");
      when(userDirectory.find(UserFilter.byIdentity(identity))).thenReturn(List.of());
      when(signupPolicy.isSignupEnabled()).thenReturn(false);

      final LoginResult result =
          validator.validate(new LoginCredential.FederatedIdentity("principal-9"));

      assertThat(result).isInstanceOf(LoginResult.Rejected.class);
    }

    @Test
    void routesAnonymousCredentialToHashedLookup() {
      when(secretStore.get(SecretName.ACCESS_TOKEN_SALT)).thenReturn("salt");
      when(accessTokenHasher.deriveAccessToken("raw", "salt")).thenReturn("h");
      when(userDirectory.find(UserFilter.byAccessTokenHash("h"))).thenReturn(List.of());

      final LoginResult result = validator.validate(new LoginCredential.Anonymous("raw"));

      assertThat(result)
          .isEqualTo(
              LoginResult.rejected(LoginFailure.UNAUTHENTICATED, "access token is invalid"));
    }
  }

  private static UserRecord anonymousUser(String id, String accessTokenHash) {
    return new UserRecord(id, AuthProvider.ANONYMOUS, null, accessTokenHash, NOW, NOW);
  }

  private static UserRecord providerUser(String id, ProviderIdentity identity) {
    return new UserRecord(id, identity.provider(), identity.thirdPartyId(), null, NOW, NOW);
  }
}
