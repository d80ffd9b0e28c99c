/*
 * どこで: Provisioning サービス層
 * 何を: テナントの作成、オーナー資格情報の発行、プロビジョニングのキュー投入を行う
 * なぜ: Idempotency-Key 付きの再送や二度押しでテナントが重複作成されないようにするため
 */
package com.teamplatform.provisioning.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamplatform.provisioning.api.ApiErrorCode;
import com.teamplatform.provisioning.api.request.SignupRequest;
import com.teamplatform.provisioning.api.response.SignupResponse;
import com.teamplatform.provisioning.credential.CredentialIssuer;
import com.teamplatform.provisioning.credential.IssuedCredential;
import com.teamplatform.provisioning.idempotency.IdempotencyDecision;
import com.teamplatform.provisioning.idempotency.IdempotencyLedger;
import com.teamplatform.provisioning.idempotency.RequestHasher;
import com.teamplatform.provisioning.tenant.Tenant;
import com.teamplatform.provisioning.tenant.TenantPlan;
import com.teamplatform.provisioning.tenant.TenantRepository;
import com.teamplatform.provisioning.tenant.TenantWebhook;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class SignupService {

    private static final Logger logger = LoggerFactory.getLogger(SignupService.class);

    private static final String ACTION_SIGNUP = "SIGNUP";
    private static final Duration TRIAL_PERIOD = Duration.ofDays(14);
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int ID_SUFFIX_LENGTH = 7;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final TenantRepository tenantRepository;
    private final CredentialIssuer credentialIssuer;
    private final IdempotencyLedger idempotencyLedger;
    private final RequestHasher requestHasher;
    private final ProvisioningQueueClient queueClient;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final ProvisioningMetrics metrics;
    private final Clock clock;

    /**
     * 役割: サインアップを 1 回だけ実行する。
     *
     * <p>期待動作: 同じ Idempotency-Key と同じ内容の再送には保存済みのレスポンスを返し、テナントは作り直さない。
     * テナント作成に失敗した場合は予約を外し、同じキーでやり直せるようにする。テナント保存後の冪等性記録の確定失敗と
     * キュー投入の失敗はサインアップを失敗させない。
     */
    public SignupResponse signup(SignupRequest request, String idempotencyKey) {
        String requestHash = requestHasher.hash(ACTION_SIGNUP, hashFields(request));
        IdempotencyDecision decision = idempotencyLedger.begin(idempotencyKey, requestHash);
        if (decision.hit()) {
            metrics.recordSignup("replayed");
            return readStoredResponse(decision.record().responseBody());
        }
        SignupResponse response;
        try {
            response = createTenant(request);
        } catch (RuntimeException ex) {
            idempotencyLedger.release(idempotencyKey);
            metrics.recordSignup(ex instanceof SignupRejectedException ? "rejected" : "failed");
            throw ex;
        }
        metrics.recordSignup("created");
        // テナントは保存済みなので、ここから先の失敗でサインアップを失敗させない
        commitQuietly(idempotencyKey, requestHash, response);
        queueClient.queueAsync(response.tenant().id());
        return response;
    }

    private void commitQuietly(String idempotencyKey, String requestHash, SignupResponse response) {
        try {
            idempotencyLedger.commit(idempotencyKey, requestHash, HttpStatus.OK.value(), serialize(response));
        } catch (RuntimeException ex) {
            // 予約は reservationTtl で失効する
            logger.warn("idempotency commit failed tenantId={} key={}",
                    response.tenant().id(), idempotencyKey, ex);
            metrics.recordIdempotency("commit_failed");
        }
    }

    private SignupResponse createTenant(SignupRequest request) {
        TenantPlan plan = TenantPlan.fromValue(request.plan());
        String slug = request.clubSlug().trim();
        String email = request.email().trim().toLowerCase(Locale.ROOT);
        if (plan == TenantPlan.STARTER && isBlank(request.webhookUrl())) {
            throw new SignupRejectedException(
                    ApiErrorCode.INVALID_REQUEST, "webhookUrl is required for the starter plan");
        }
        if (tenantRepository.existsBySlug(slug)) {
            throw new SignupRejectedException(ApiErrorCode.SLUG_TAKEN, "That club slug is already in use");
        }
        if (tenantRepository.existsByEmail(email)) {
            throw new SignupRejectedException(ApiErrorCode.EMAIL_EXISTS, "That email is already registered");
        }
        Instant now = clock.instant();
        Tenant tenant = new Tenant(
                newTenantId(now),
                slug,
                request.clubName().trim(),
                email,
                plan,
                Tenant.STATUS_TRIAL,
                now.plus(TRIAL_PERIOD),
                false,
                null,
                null,
                null,
                null,
                null,
                now,
                now);
        try {
            // テナントと webhook は同じトランザクションで保存する
            transactionTemplate.executeWithoutResult(status -> {
                tenantRepository.insert(tenant);
                if (plan == TenantPlan.STARTER) {
                    tenantRepository.saveWebhook(new TenantWebhook(
                            tenant.id(), request.webhookUrl().trim(), webhookSecret(request), null), now);
                }
            });
        } catch (DuplicateKeyException ex) {
            // 事前チェック後に同じ slug か email が先に登録された
            throw new SignupRejectedException(
                    tenantRepository.existsByEmail(email) ? ApiErrorCode.EMAIL_EXISTS : ApiErrorCode.SLUG_TAKEN,
                    "club already registered");
        }
        IssuedCredential ownerCredential = credentialIssuer.issueTenantAdmin(tenant.id(), email, email);
        logger.info("tenant created tenantId={} slug={} plan={}", tenant.id(), slug, plan.value());
        return new SignupResponse(
                true,
                new SignupResponse.SignupTenant(
                        tenant.id(),
                        tenant.slug(),
                        tenant.name(),
                        tenant.email(),
                        plan.value(),
                        tenant.status(),
                        tenant.trialEndsAt()),
                ownerCredential.token());
    }

    private Map<String, Object> hashFields(SignupRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("clubName", request.clubName());
        fields.put("clubSlug", request.clubSlug());
        fields.put("email", request.email());
        fields.put("plan", request.plan());
        fields.put("webhookUrl", request.webhookUrl());
        // 秘密値そのものは台帳に残さない
        fields.put("webhookSecretSha256",
                request.webhookSecret() == null ? null : requestHasher.digest(request.webhookSecret()));
        return fields;
    }

    private String newTenantId(Instant now) {
        StringBuilder suffix = new StringBuilder(ID_SUFFIX_LENGTH);
        for (int i = 0; i < ID_SUFFIX_LENGTH; i++) {
            suffix.append(ID_ALPHABET.charAt(RANDOM.nextInt(ID_ALPHABET.length())));
        }
        return "tenant_" + now.toEpochMilli() + "_" + suffix;
    }

    private String webhookSecret(SignupRequest request) {
        if (!isBlank(request.webhookSecret())) {
            return request.webhookSecret();
        }
        byte[] secret = new byte[32];
        RANDOM.nextBytes(secret);
        return HexFormat.of().formatHex(secret);
    }

    private SignupResponse readStoredResponse(String body) {
        try {
            return objectMapper.readValue(body, SignupResponse.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to parse idempotency response", ex);
        }
    }

    private String serialize(SignupResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize signup response", ex);
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
