/*
 * どこで: Provisioning Actor の永続化
 * 何を: ProvisioningState を KeyValueStore に JSON で保存する
 * なぜ: プロセス再起動後もチェックポイントから再開できるようにするため
 */
package com.teamplatform.provisioning.actor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamplatform.common.store.KeyValueStore;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProvisioningStateRepository {

  private static final String KEY_PREFIX = "provision:state:";

  private final KeyValueStore store;
  private final ObjectMapper objectMapper;

  public Optional<ProvisioningState> find(String tenantId) {
    return store.get(KEY_PREFIX + tenantId).map(this::deserialize);
  }

  /** 状態は削除しないため TTL は付けない。 */
  public void save(ProvisioningState state) {
    store.put(KEY_PREFIX + state.tenantId(), serialize(state), null);
  }

  private String serialize(ProvisioningState state) {
    try {
      return objectMapper.writeValueAsString(state);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize provisioning state", ex);
    }
  }

  private ProvisioningState deserialize(String json) {
    try {
      return objectMapper.readValue(json, ProvisioningState.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("provisioning state is unreadable", ex);
    }
  }
}
