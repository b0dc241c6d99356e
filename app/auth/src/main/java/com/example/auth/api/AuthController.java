/*
 * どこで: app/auth/src/main/java/com/example/auth/api/AuthController.java
 * 何を: 3 種類の資格情報でログインしトークンを返す API を提供
 * なぜ: 資格情報ごとの入口を一箇所に集め、判定は LoginValidator に委ねるため
 */
package com.example.auth.api;

import com.example.auth.api.request.AnonymousLoginRequest;
import com.example.auth.api.request.InternetIdentityLoginRequest;
import com.example.auth.api.request.OAuthLoginRequest;
import com.example.auth.api.response.AuthTokenResponse;
import com.example.auth.model.LoginCredential;
import com.example.auth.service.LoginResult;
import com.example.auth.service.LoginValidator;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final LoginValidator loginValidator;

    public AuthController(LoginValidator loginValidator) {
        this.loginValidator = loginValidator;
    }

    /**
     * 役割:
     * - 匿名アクセストークンで既存ユーザーにログインする。
     *
     * 期待動作:
     * - トークンに対応するユーザーがいなければ 403 UNAUTHENTICATED を返す。
     * - このルートでユーザーが作成されることはない。
     */
    @PostMapping("/anonymous")
    public ResponseEntity<?> loginAnonymous(@Valid @RequestBody AnonymousLoginRequest request) {
        return toResponse(
                loginValidator.validate(new LoginCredential.Anonymous(request.accessToken())));
    }

    /**
     * 役割:
     * - Internet Identity の principal id でログインする。
     *
     * 期待動作:
     * - 未登録の principal は signup 有効時のみユーザー作成される。
     * - signup 無効時は 403 SIGNUP_DISABLED を返す。
     */
    @PostMapping("/internet-identity")
    public ResponseEntity<?> loginInternetIdentity(
            @Valid @RequestBody InternetIdentityLoginRequest request) {
        return toResponse(
                loginValidator.validate(
                        new LoginCredential.FederatedIdentity(request.principalId())));
    }

    /**
     * 役割:
     * - OAuth ゲートウェイが検証済みの provider + thirdPartyId でログインする。
     *
     * 期待動作:
     * - 内部トークン付きの呼び出しのみ受け付ける(Security 設定側で判定)。
     * - ユーザー作成の可否は Internet Identity と同じ signup ポリシーに従う。
     */
    @PostMapping("/oauth:validate")
    public ResponseEntity<?> loginOAuth(@Valid @RequestBody OAuthLoginRequest request) {
        return toResponse(
                loginValidator.validate(
                        new LoginCredential.OAuth(request.provider(), request.thirdPartyId())));
    }

    private ResponseEntity<?> toResponse(LoginResult result) {
        if (result instanceof LoginResult.Issued issued) {
            return ResponseEntity.ok(new AuthTokenResponse(issued.token().value()));
        }
        final LoginResult.Rejected rejected = (LoginResult.Rejected) result;
        final ApiErrorCode code =
                switch (rejected.failure()) {
                    case UNAUTHENTICATED -> ApiErrorCode.UNAUTHENTICATED;
                    case SIGNUP_DISABLED -> ApiErrorCode.SIGNUP_DISABLED;
                };
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(new ApiErrorResponse(code, rejected.message()));
    }
}
