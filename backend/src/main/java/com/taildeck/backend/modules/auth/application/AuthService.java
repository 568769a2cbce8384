package com.taildeck.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.taildeck.backend.global.error.ProblemException;
import com.taildeck.backend.modules.audit.application.AuditActor;
import com.taildeck.backend.modules.audit.application.AuditEntry;
import com.taildeck.backend.modules.audit.application.AuditLogService;
import com.taildeck.backend.modules.audit.domain.AuditAction;
import com.taildeck.backend.modules.audit.domain.AuditResourceType;
import com.taildeck.backend.modules.auth.domain.UserSession;
import com.taildeck.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.taildeck.backend.modules.auth.presentation.dto.LoginRequest;
import com.taildeck.backend.modules.auth.presentation.dto.LoginResponse;
import com.taildeck.backend.modules.auth.presentation.dto.LogoutRequest;
import com.taildeck.backend.modules.auth.presentation.dto.RefreshRequest;
import com.taildeck.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.taildeck.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.taildeck.backend.modules.identity.application.IdentitySyncService;
import com.taildeck.backend.modules.identity.domain.AppUser;
import com.taildeck.backend.modules.identity.domain.ExternalIdentity;
import com.taildeck.backend.modules.identity.infrastructure.persistence.AppUserRepository;
import com.taildeck.backend.modules.rbac.domain.RoleHierarchy;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.modules.rbac.domain.RolePermissionCatalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 로그인/세션 갱신/로그아웃.
 * 로그인 시 역할 동기화가 저장소 오류로 실패하면 USER 역할만 가진 갱신 불가 세션을 발급한다.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String REASON_EXPIRED = "EXPIRED";
    private static final String REASON_ROTATED = "ROTATED";
    private static final String REASON_LOGOUT = "LOGOUT";
    private static final int REFRESH_TOKEN_BYTES = 32;

    private final IdentityTokenVerifier identityTokenVerifier;
    private final IdentitySyncService identitySyncService;
    private final AppUserRepository appUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final JwtTokenService jwtTokenService;
    private final AuditLogService auditLogService;
    private final RoleHierarchy roleHierarchy;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public AuthService(
            IdentityTokenVerifier identityTokenVerifier,
            IdentitySyncService identitySyncService,
            AppUserRepository appUserRepository,
            UserSessionRepository userSessionRepository,
            JwtTokenService jwtTokenService,
            AuditLogService auditLogService,
            RoleHierarchy roleHierarchy,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.identityTokenVerifier = identityTokenVerifier;
        this.identitySyncService = identitySyncService;
        this.appUserRepository = appUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.jwtTokenService = jwtTokenService;
        this.auditLogService = auditLogService;
        this.roleHierarchy = roleHierarchy;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public LoginResponse login(LoginRequest request, String clientIp) {
        ExternalIdentity identity = identityTokenVerifier.verify(request.identityToken());
        UUID userId = AppUser.idForSubject(identity.subject());

        Set<RoleName> roles;
        String refreshToken;
        try {
            identitySyncService.syncRoles(identity);
            identitySyncService.ensureOwnerExists(userId);
            roles = identitySyncService.currentRoles(userId);
            refreshToken = openSession(userId);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Role sync failed for subject={}, issuing fallback {} session",
                    identity.subject(), roleHierarchy.lowest(), ex);
            roles = EnumSet.of(roleHierarchy.lowest());
            refreshToken = null;
        }

        TokenPairResponse tokens = jwtTokenService.issueTokens(userId, identity.email(), identity.name(), roles, refreshToken);
        auditLogService.logAudit(AuditEntry.of(
                        AuditAction.USER_LOGIN,
                        new AuditActor(userId, identity.email(), clientIp),
                        AuditResourceType.USER,
                        userId.toString())
                .withMetadata("roles", roles.stream().map(Enum::name).sorted().toList()));

        return new LoginResponse(tokens, buildProfile(userId, identity.email(), identity.name(), roles));
    }

    /**
     * 갱신 토큰을 회전하고 역할을 저장소에서 다시 읽어 새 클레임을 발급한다.
     */
    public LoginResponse refresh(RefreshRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String presentedHash = hash(request.refreshToken());

        RefreshedSession refreshed = transactionTemplate.execute(status -> {
            UserSession session = userSessionRepository.findByRefreshTokenHash(presentedHash)
                    .orElseThrow(AuthService::invalidRefreshToken);
            if (session.getRevokedAt() != null) {
                throw invalidRefreshToken();
            }
            if (!session.getExpiresAt().isAfter(now)) {
                session.revoke(now, REASON_EXPIRED);
                return null;
            }

            // 재사용 방지: 기존 세션은 즉시 폐기하고 새 토큰을 발급한다.
            session.revoke(now, REASON_ROTATED);
            AppUser user = session.getUser();
            userSessionRepository.revokeExpiredSessions(user.getId(), now, REASON_EXPIRED);

            String rotated = newRefreshToken();
            persistSession(user, rotated, now);
            Set<RoleName> roles = identitySyncService.currentRoles(user.getId());
            return new RefreshedSession(user.getId(), user.getEmail(), user.getName(), roles, rotated);
        });

        if (refreshed == null) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_EXPIRED", "Unauthorized",
                    "Session expired, please sign in again");
        }

        TokenPairResponse tokens = jwtTokenService.issueTokens(
                refreshed.userId(), refreshed.email(), refreshed.name(), refreshed.roles(), refreshed.refreshToken());
        return new LoginResponse(tokens, buildProfile(refreshed.userId(), refreshed.email(), refreshed.name(), refreshed.roles()));
    }

    public void logout(LogoutRequest request, String clientIp) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String presentedHash = hash(request.refreshToken());

        AppUser user = transactionTemplate.execute(status -> userSessionRepository.findByRefreshTokenHash(presentedHash)
                .filter(session -> session.getRevokedAt() == null)
                .map(session -> {
                    session.revoke(now, REASON_LOGOUT);
                    return session.getUser();
                })
                .orElse(null));

        if (user == null) {
            // 등록되지 않은 토큰도 동일하게 응답해 토큰 유효 여부가 노출되지 않도록 한다.
            return;
        }
        auditLogService.logAudit(AuditEntry.of(
                AuditAction.USER_LOGOUT,
                new AuditActor(user.getId(), user.getEmail(), clientIp),
                AuditResourceType.USER,
                user.getId().toString()));
    }

    public UserProfileResponse buildProfile(UUID userId, String email, String name, Set<RoleName> roles) {
        List<String> roleNames = roles.stream()
                .sorted((a, b) -> Integer.compare(roleHierarchy.levelOf(b), roleHierarchy.levelOf(a)))
                .map(Enum::name)
                .toList();
        List<String> permissions = RolePermissionCatalog.permissionsOf(roles).stream()
                .map(permission -> permission.value())
                .toList();
        String effectiveRole = roleHierarchy.highestRole(roles).map(Enum::name).orElse(null);
        return new UserProfileResponse(userId, email, name, roleNames, effectiveRole, permissions);
    }

    private String openSession(UUID userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String refreshToken = newRefreshToken();
        transactionTemplate.executeWithoutResult(status -> {
            AppUser user = appUserRepository.getReferenceById(userId);
            userSessionRepository.revokeExpiredSessions(userId, now, REASON_EXPIRED);
            persistSession(user, refreshToken, now);
        });
        return refreshToken;
    }

    private void persistSession(AppUser user, String refreshToken, OffsetDateTime issuedAt) {
        UserSession session = new UserSession();
        session.setUser(user);
        session.setRefreshTokenHash(hash(refreshToken));
        session.setIssuedAt(issuedAt);
        session.setExpiresAt(issuedAt.plus(jwtTokenService.getSessionMaxAge()));
        userSessionRepository.save(session);
    }

    private String newRefreshToken() {
        byte[] bytes = new byte[REFRESH_TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    static String hash(String refreshToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(refreshToken.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private static ProblemException invalidRefreshToken() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN", "Unauthorized");
    }

    private record RefreshedSession(UUID userId, String email, String name, Set<RoleName> roles, String refreshToken) {
    }
}
