/*
 * どこで: Provisioning 永続化層
 * 何を: テナントと、プロビジョニングで作られる付随データを JDBC で読み書きする
 * なぜ: ステップを再実行しても結果が重複しないよう、SQL 側で冪等に書き込むため
 */
package com.teamplatform.provisioning.tenant;

import static com.teamplatform.common.jdbc.JdbcTimestamps.toInstant;
import static com.teamplatform.common.jdbc.JdbcTimestamps.toTimestamp;

import com.teamplatform.provisioning.actor.ProvisioningSideChannel;
import com.teamplatform.provisioning.actor.ProvisioningStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TenantRepository implements ProvisioningSideChannel {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public void insert(Tenant tenant) {
        String sql = """
                INSERT INTO tenants (
                    id, slug, name, email, plan, status, trial_ends_at, route_ready,
                    created_at, updated_at
                ) VALUES (
                    :id, :slug, :name, :email, :plan, :status, :trialEndsAt, FALSE,
                    :createdAt, :updatedAt
                )
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", tenant.id())
                .addValue("slug", tenant.slug())
                .addValue("name", tenant.name())
                .addValue("email", tenant.email())
                .addValue("plan", tenant.plan().value())
                .addValue("status", tenant.status())
                .addValue("trialEndsAt", toTimestamp(tenant.trialEndsAt()))
                .addValue("createdAt", toTimestamp(tenant.createdAt()))
                .addValue("updatedAt", toTimestamp(tenant.updatedAt()));
        jdbcTemplate.update(sql, params);
    }

    public Optional<Tenant> findById(String tenantId) {
        String sql = """
                SELECT id, slug, name, email, plan, status, trial_ends_at, route_ready,
                       owner_email_sent_at, provisioned_at, provision_state, provision_reason,
                       provision_updated_at, created_at, updated_at
                FROM tenants
                WHERE id = :id
                """;
        List<Tenant> results = jdbcTemplate.query(
                sql, new MapSqlParameterSource("id", tenantId), (rs, rowNum) -> mapTenant(rs));
        return results.stream().findFirst();
    }

    public boolean existsBySlug(String slug) {
        return exists("SELECT COUNT(*) FROM tenants WHERE slug = :value", slug);
    }

    public boolean existsByEmail(String email) {
        return exists("SELECT COUNT(*) FROM tenants WHERE lower(email) = lower(:value)", email);
    }

    public void markRouteReady(String tenantId, Instant now) {
        String sql = """
                UPDATE tenants SET route_ready = TRUE, updated_at = :now WHERE id = :id
                """;
        jdbcTemplate.update(sql, idAndNow(tenantId, now));
    }

    public Optional<TenantWebhook> findWebhook(String tenantId) {
        String sql = """
                SELECT tenant_id, webhook_url, webhook_secret, validated_at
                FROM tenant_webhooks
                WHERE tenant_id = :tenantId
                """;
        List<TenantWebhook> results = jdbcTemplate.query(
                sql,
                new MapSqlParameterSource("tenantId", tenantId),
                (rs, rowNum) -> new TenantWebhook(
                        rs.getString("tenant_id"),
                        rs.getString("webhook_url"),
                        rs.getString("webhook_secret"),
                        toInstant(rs.getTimestamp("validated_at"))));
        return results.stream().findFirst();
    }

    public void saveWebhook(TenantWebhook webhook, Instant now) {
        String sql = """
                INSERT INTO tenant_webhooks (tenant_id, webhook_url, webhook_secret, created_at)
                VALUES (:tenantId, :url, :secret, :now)
                ON CONFLICT (tenant_id) DO UPDATE
                SET webhook_url = EXCLUDED.webhook_url,
                    webhook_secret = EXCLUDED.webhook_secret,
                    validated_at = NULL
                """;
        jdbcTemplate.update(sql, new MapSqlParameterSource()
                .addValue("tenantId", webhook.tenantId())
                .addValue("url", webhook.webhookUrl())
                .addValue("secret", webhook.webhookSecret())
                .addValue("now", toTimestamp(now)));
    }

    public void markWebhookValidated(String tenantId, Instant now) {
        String sql = """
                UPDATE tenant_webhooks SET validated_at = :now WHERE tenant_id = :id
                """;
        jdbcTemplate.update(sql, idAndNow(tenantId, now));
    }

    public void upsertAutomation(String tenantId, String storageNamespace, String cronSchedule, Instant now) {
        String sql = """
                INSERT INTO tenant_automations (tenant_id, storage_namespace, cron_schedule, updated_at)
                VALUES (:id, :namespace, :cron, :now)
                ON CONFLICT (tenant_id) DO UPDATE
                SET storage_namespace = EXCLUDED.storage_namespace,
                    cron_schedule = EXCLUDED.cron_schedule,
                    updated_at = EXCLUDED.updated_at
                """;
        jdbcTemplate.update(sql, idAndNow(tenantId, now)
                .addValue("namespace", storageNamespace)
                .addValue("cron", cronSchedule));
    }

    public void recordAutomationDeploy(String tenantId, String deployJobId, String deployStatus, Instant now) {
        String sql = """
                UPDATE tenant_automations
                SET deploy_job_id = :jobId, deploy_status = :status, updated_at = :now
                WHERE tenant_id = :id
                """;
        jdbcTemplate.update(sql, idAndNow(tenantId, now)
                .addValue("jobId", deployJobId)
                .addValue("status", deployStatus));
    }

    /** (tenant_id, kind) が既にあれば何もしない。 */
    public void insertContentIfAbsent(
            String tenantId, String kind, String title, String body, Instant scheduledAt, Instant now) {
        String sql = """
                INSERT INTO tenant_content (id, tenant_id, kind, title, body, scheduled_at, created_at)
                VALUES (:contentId, :id, :kind, :title, :body, :scheduledAt, :now)
                ON CONFLICT (tenant_id, kind) DO NOTHING
                """;
        jdbcTemplate.update(sql, idAndNow(tenantId, now)
                .addValue("contentId", UUID.randomUUID())
                .addValue("kind", kind)
                .addValue("title", title)
                .addValue("body", body)
                .addValue("scheduledAt", toTimestamp(scheduledAt)));
    }

    public void markOwnerEmailSent(String tenantId, Instant now) {
        String sql = """
                UPDATE tenants SET owner_email_sent_at = :now, updated_at = :now WHERE id = :id
                """;
        jdbcTemplate.update(sql, idAndNow(tenantId, now));
    }

    public void markActive(String tenantId, Instant now) {
        String sql = """
                UPDATE tenants
                SET status = 'active', provisioned_at = COALESCE(provisioned_at, :now), updated_at = :now
                WHERE id = :id
                """;
        jdbcTemplate.update(sql, idAndNow(tenantId, now));
    }

    @Override
    public void publish(String tenantId, ProvisioningStatus status, String reason, Instant updatedAt) {
        String sql = """
                UPDATE tenants
                SET provision_state = :state,
                    provision_reason = :reason,
                    provision_updated_at = :now
                WHERE id = :id
                """;
        jdbcTemplate.update(sql, idAndNow(tenantId, updatedAt)
                .addValue("state", status.value())
                .addValue("reason", reason));
    }

    private boolean exists(String sql, String value) {
        Integer count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource("value", value), Integer.class);
        return count != null && count > 0;
    }

    private MapSqlParameterSource idAndNow(String tenantId, Instant now) {
        return new MapSqlParameterSource()
                .addValue("id", tenantId)
                .addValue("now", toTimestamp(now));
    }

    private Tenant mapTenant(ResultSet rs) throws SQLException {
        return new Tenant(
                rs.getString("id"),
                rs.getString("slug"),
                rs.getString("name"),
                rs.getString("email"),
                TenantPlan.fromValue(rs.getString("plan")),
                rs.getString("status"),
                toInstant(rs.getTimestamp("trial_ends_at")),
                rs.getBoolean("route_ready"),
                toInstant(rs.getTimestamp("owner_email_sent_at")),
                toInstant(rs.getTimestamp("provisioned_at")),
                rs.getString("provision_state"),
                rs.getString("provision_reason"),
                toInstant(rs.getTimestamp("provision_updated_at")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }
}
