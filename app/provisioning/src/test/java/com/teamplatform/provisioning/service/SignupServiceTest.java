/*
 * どこで: SignupService の単体テスト
 * 何を: テナント作成、重複の拒否、Idempotency-Key による再生、キュー投入を検証する
 * なぜ: 再送や二度押しでテナントとオーナー資格情報が二重に作られないことを保証するため
 */
package com.teamplatform.provisioning.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.teamplatform.common.store.InMemoryKeyValueStore;
import com.teamplatform.common.store.StoreUnavailableException;
import com.teamplatform.provisioning.api.ApiErrorCode;
import com.teamplatform.provisioning.api.request.SignupRequest;
import com.teamplatform.provisioning.api.response.SignupResponse;
import com.teamplatform.provisioning.config.IdempotencyProperties;
import com.teamplatform.provisioning.credential.CredentialAudience;
import com.teamplatform.provisioning.credential.VerifiedCredential;
import com.teamplatform.provisioning.idempotency.IdempotencyConflictException;
import com.teamplatform.provisioning.idempotency.IdempotencyLedger;
import com.teamplatform.provisioning.idempotency.RequestHasher;
import com.teamplatform.provisioning.support.CredentialFixture;
import com.teamplatform.provisioning.tenant.Tenant;
import com.teamplatform.provisioning.tenant.TenantPlan;
import com.teamplatform.provisioning.tenant.TenantRepository;
import com.teamplatform.provisioning.tenant.TenantWebhook;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

class SignupServiceTest {

    private static final String WEBHOOK_URL = "https://hooks.tigers.test/provision";

    private final CredentialFixture fixture = new CredentialFixture();
    private final TenantRepository tenantRepository = mock(TenantRepository.class);
    private final ProvisioningQueueClient queueClient = mock(ProvisioningQueueClient.class);
    private final SignupService signupService = new SignupService(
            tenantRepository,
            fixture.issuer,
            new IdempotencyLedger(
                    fixture.store,
                    fixture.objectMapper,
                    new IdempotencyProperties(Duration.ofHours(24), Duration.ofSeconds(60)),
                    fixture.metrics,
                    fixture.clock),
            new RequestHasher(fixture.objectMapper),
            queueClient,
            new TransactionTemplate(mock(PlatformTransactionManager.class)),
            fixture.objectMapper,
            fixture.metrics,
            fixture.clock);

    @Test
    void starterSignupCreatesTrialTenantWebhookAndOwnerCredential() {
        SignupResponse response = signupService.signup(starterRequest("secret-from-the-club-0001"), null);

        ArgumentCaptor<Tenant> tenant = ArgumentCaptor.forClass(Tenant.class);
        verify(tenantRepository).insert(tenant.capture());
        assertThat(tenant.getValue().id()).matches("tenant_\\d+_[0-9a-z]{7}");
        assertThat(tenant.getValue().email()).isEqualTo("owner@tigers.test");
        assertThat(tenant.getValue().plan()).isEqualTo(TenantPlan.STARTER);
        assertThat(tenant.getValue().trialEndsAt())
                .isEqualTo(fixture.clock.instant().plus(Duration.ofDays(14)));

        ArgumentCaptor<TenantWebhook> webhook = ArgumentCaptor.forClass(TenantWebhook.class);
        verify(tenantRepository).saveWebhook(webhook.capture(), eq(fixture.clock.instant()));
        assertThat(webhook.getValue().webhookUrl()).isEqualTo(WEBHOOK_URL);
        assertThat(webhook.getValue().webhookSecret()).isEqualTo("secret-from-the-club-0001");

        assertThat(response.success()).isTrue();
        assertThat(response.tenant().status()).isEqualTo("trial");
        VerifiedCredential owner = fixture.verifier.verify(response.jwt(), CredentialAudience.TENANT_ADMIN);
        assertThat(owner.tenantId()).isEqualTo(response.tenant().id());
        assertThat(owner.email()).isEqualTo("owner@tigers.test");
        verify(queueClient).queueAsync(response.tenant().id());
    }

    @Test
    void starterSignupGeneratesWebhookSecretWhenOmitted() {
        signupService.signup(starterRequest(null), null);

        ArgumentCaptor<TenantWebhook> webhook = ArgumentCaptor.forClass(TenantWebhook.class);
        verify(tenantRepository).saveWebhook(webhook.capture(), any());
        assertThat(webhook.getValue().webhookSecret()).matches("[0-9a-f]{64}");
    }

    @Test
    void proSignupDoesNotStoreWebhook() {
        signupService.signup(
                new SignupRequest("Lions RC", "lions", "owner@lions.test", "pro", null, null), null);

        verify(tenantRepository).insert(any());
        verify(tenantRepository, never()).saveWebhook(any(), any());
    }

    @Test
    void starterSignupWithoutWebhookIsRejected() {
        assertThatThrownBy(() -> signupService.signup(
                new SignupRequest("Tigers FC", "tigers", "owner@tigers.test", "starter", null, null), null))
                .isInstanceOf(SignupRejectedException.class)
                .extracting(ex -> ((SignupRejectedException) ex).code())
                .isEqualTo(ApiErrorCode.INVALID_REQUEST);
        verify(tenantRepository, never()).insert(any());
    }

    @Test
    void takenSlugAndEmailAreRejected() {
        when(tenantRepository.existsBySlug("tigers")).thenReturn(true);

        assertThatThrownBy(() -> signupService.signup(starterRequest(null), null))
                .isInstanceOf(SignupRejectedException.class)
                .extracting(ex -> ((SignupRejectedException) ex).code())
                .isEqualTo(ApiErrorCode.SLUG_TAKEN);

        when(tenantRepository.existsBySlug("tigers")).thenReturn(false);
        when(tenantRepository.existsByEmail("owner@tigers.test")).thenReturn(true);

        assertThatThrownBy(() -> signupService.signup(starterRequest(null), null))
                .isInstanceOf(SignupRejectedException.class)
                .extracting(ex -> ((SignupRejectedException) ex).code())
                .isEqualTo(ApiErrorCode.EMAIL_EXISTS);
        verify(queueClient, never()).queueAsync(anyString());
    }

    @Test
    void concurrentInsertRaceIsReportedAsDuplicate() {
        doThrow(new DuplicateKeyException("tenants_slug_key")).when(tenantRepository).insert(any());

        assertThatThrownBy(() -> signupService.signup(starterRequest(null), null))
                .isInstanceOf(SignupRejectedException.class)
                .extracting(ex -> ((SignupRejectedException) ex).code())
                .isEqualTo(ApiErrorCode.SLUG_TAKEN);
    }

    @Test
    void sameIdempotencyKeyReplaysStoredResponseWithoutCreatingAgain() {
        SignupResponse first = signupService.signup(starterRequest(null), "signup-key-1");
        SignupResponse second = signupService.signup(starterRequest(null), "signup-key-1");

        assertThat(second).isEqualTo(first);
        verify(tenantRepository, times(1)).insert(any());
        verify(queueClient, times(1)).queueAsync(anyString());
        assertThat(fixture.meterRegistry.get("signup.total")
                .tag("result", "replayed").counter().count()).isEqualTo(1.0d);
    }

    @Test
    void sameIdempotencyKeyWithDifferentBodyConflicts() {
        signupService.signup(starterRequest(null), "signup-key-1");

        assertThatThrownBy(() -> signupService.signup(
                new SignupRequest("Tigers FC", "tigers-2", "owner@tigers.test", "starter", WEBHOOK_URL, null),
                "signup-key-1"))
                .isInstanceOf(IdempotencyConflictException.class);
    }

    @Test
    void failedSignupReleasesIdempotencyKey() {
        when(tenantRepository.existsBySlug("tigers")).thenReturn(true);
        assertThatThrownBy(() -> signupService.signup(starterRequest(null), "signup-key-1"))
                .isInstanceOf(SignupRejectedException.class);

        when(tenantRepository.existsBySlug("tigers")).thenReturn(false);
        SignupResponse response = signupService.signup(starterRequest(null), "signup-key-1");

        assertThat(response.success()).isTrue();
    }

    @Test
    void sameIdempotencyKeyWithDifferentWebhookSecretConflicts() {
        signupService.signup(starterRequest("secret-from-the-club-0001"), "signup-key-1");

        assertThatThrownBy(() -> signupService.signup(starterRequest("secret-from-the-club-0002"), "signup-key-1"))
                .isInstanceOf(IdempotencyConflictException.class);
        verify(tenantRepository, times(1)).insert(any());
    }

    @Test
    void commitFailureAfterInsertStillQueuesTenantAndReturnsResponse() {
        InMemoryKeyValueStore failingStore = new InMemoryKeyValueStore(fixture.clock) {
            @Override
            public void put(String key, String value, Duration ttl) {
                throw new StoreUnavailableException("redis write failed", null);
            }
        };
        SignupService service = new SignupService(
                tenantRepository,
                fixture.issuer,
                new IdempotencyLedger(
                        failingStore,
                        fixture.objectMapper,
                        new IdempotencyProperties(Duration.ofHours(24), Duration.ofSeconds(60)),
                        fixture.metrics,
                        fixture.clock),
                new RequestHasher(fixture.objectMapper),
                queueClient,
                new TransactionTemplate(mock(PlatformTransactionManager.class)),
                fixture.objectMapper,
                fixture.metrics,
                fixture.clock);

        SignupResponse response = service.signup(starterRequest(null), "signup-key-1");

        assertThat(response.success()).isTrue();
        verify(tenantRepository, times(1)).insert(any());
        verify(queueClient).queueAsync(response.tenant().id());
        assertThat(fixture.meterRegistry.get("signup.total")
                .tag("result", "created").counter().count()).isEqualTo(1.0d);
    }

    private SignupRequest starterRequest(String webhookSecret) {
        return new SignupRequest("Tigers FC", "tigers", "Owner@Tigers.test", "starter", WEBHOOK_URL, webhookSecret);
    }
}
