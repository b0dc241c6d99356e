package com.example.auth.service;

import com.example.auth.config.AuthJwtProperties;
import com.example.auth.model.SessionClaims;
import com.example.auth.model.SignedToken;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import javax.crypto.SecretKey;
import lombok.NonNull;
import org.springframework.stereotype.Service;

/**
 * HS256 JWT signer. The token carries the session claims plus {@code iat}/{@code exp} and, when
 * configured, {@code iss}.
 */
@Service
public class JwtTokenSigner implements TokenSigner {

  public static final String CLAIM_ID = "id";

  private static final int MIN_SECRET_BYTES = 32;

  private final AuthJwtProperties properties;
  private final Clock clock;
  private final SecretKey key;

  public JwtTokenSigner(SecretStore secretStore, AuthJwtProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
    this.key = initKey(secretStore.get(SecretName.JWT_SECRET_KEY));
    if (properties.expiresIn().isZero() || properties.expiresIn().isNegative()) {
      throw new IllegalArgumentException("auth.jwt.expires-in must be positive");
    }
  }

  @Override
  public SignedToken sign(@NonNull SessionClaims claims) {
    if (claims.id() == null || claims.id().isBlank()) {
      throw new IllegalArgumentException("claims id is required");
    }
    final Instant now = Instant.now(clock);
    final JwtBuilder builder =
        Jwts.builder()
            .claim(CLAIM_ID, claims.id())
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plus(properties.expiresIn())))
            .signWith(key, Jwts.SIG.HS256);
    if (!properties.issuer().isBlank()) {
      builder.issuer(properties.issuer());
    }
    return new SignedToken(builder.compact());
  }

  private SecretKey initKey(String secret) {
    final byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
    if (bytes.length < MIN_SECRET_BYTES) {
      throw new IllegalStateException("JWT_SECRET_KEY must be at least 32 bytes for HS256");
    }
    return Keys.hmacShaKeyFor(bytes);
  }
}
