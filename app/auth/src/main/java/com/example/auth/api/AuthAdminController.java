/*
 * どこで: app/auth/src/main/java/com/example/auth/api/AuthAdminController.java
 * 何を: signup ポリシーの参照/切替を行う管理者向け API を提供
 * なぜ: 公開 signup の開閉を運用者が再デプロイなしで行えるようにするため
 */
package com.example.auth.api;

import com.example.auth.api.request.SignupSettingRequest;
import com.example.auth.api.response.SignupSettingResponse;
import com.example.auth.service.AdminSignupService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/signup")
public class AuthAdminController {

    private static final String HEADER_ACTOR_USER_ID = "X-User-Id";
    private final AdminSignupService adminSignupService;

    public AuthAdminController(AdminSignupService adminSignupService) {
        this.adminSignupService = adminSignupService;
    }

    @GetMapping
    public ResponseEntity<SignupSettingResponse> getSignupSetting() {
        return ResponseEntity.ok(new SignupSettingResponse(adminSignupService.isSignupEnabled()));
    }

    /**
     * 役割:
     * - signup 可否を更新し、監査ログへ操作記録を残す。
     *
     * 期待動作:
     * - actorUserId は内部認証フィルタが検証した X-User-Id を使う。
     * - 呼び出し権限の判定は Security 設定側で実施する。
     */
    @PutMapping
    public ResponseEntity<SignupSettingResponse> updateSignupSetting(
            @RequestHeader(value = HEADER_ACTOR_USER_ID, required = false) String actorUserId,
            @Valid @RequestBody SignupSettingRequest request) {
        final boolean enabled =
                adminSignupService.updateSignupEnabled(actorUserId, request.enabled());
        return ResponseEntity.ok(new SignupSettingResponse(enabled));
    }
}
