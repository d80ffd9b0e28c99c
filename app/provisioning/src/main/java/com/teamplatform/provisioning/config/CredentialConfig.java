/*
 * どこで: Provisioning 資格情報設定
 * 何を: HS256 の JwtEncoder / JwtDecoder を提供する
 * なぜ: 発行と検証で同じ共有鍵を使い、期限と audience の検査は CredentialVerifier 側で理由付きに行うため
 */
package com.teamplatform.provisioning.config;

import com.nimbusds.jose.jwk.source.ImmutableSecret;
import com.nimbusds.jose.proc.SecurityContext;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

@Configuration
public class CredentialConfig {

  @Bean
  SecretKey credentialSigningKey(AuthProperties properties) {
    return new SecretKeySpec(properties.secretBytes(), "HmacSHA256");
  }

  @Bean
  JwtEncoder credentialJwtEncoder(SecretKey credentialSigningKey) {
    return new NimbusJwtEncoder(new ImmutableSecret<SecurityContext>(credentialSigningKey));
  }

  @Bean
  JwtDecoder credentialJwtDecoder(SecretKey credentialSigningKey) {
    final NimbusJwtDecoder decoder =
        NimbusJwtDecoder.withSecretKey(credentialSigningKey).macAlgorithm(MacAlgorithm.HS256).build();
    // 既定の timestamp 検査は理由を区別できないため無効化し、CredentialVerifier で判定する
    decoder.setJwtValidator(jwt -> OAuth2TokenValidatorResult.success());
    return decoder;
  }
}
