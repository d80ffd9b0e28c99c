/*
 * どこで: Provisioning アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 設定クラスと共通の時刻/再試行設定をまとめて有効化するため
 */
package com.teamplatform.provisioning;

import com.teamplatform.common.config.CommonRuntimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(CommonRuntimeConfig.class)
public class ProvisioningApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProvisioningApplication.class, args);
  }
}
