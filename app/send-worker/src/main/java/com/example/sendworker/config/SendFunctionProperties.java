/*
 * どこで: Send Worker の設定バインド
 * 何を: 送信試行回数/再送遅延秒数/エラーメッセージ長の上限を保持する
 * なぜ: 送信先のレート制限に合わせて運用中に調整できるようにするため
 */
package com.example.sendworker.config;

import com.example.common.FractionalSeconds;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "send.function")
@Validated
public record SendFunctionProperties(
    @Positive int maxNumberOfAttempts,
    @Positive double sendRetryDelayNumberOfSeconds,
    @Positive int errorMessageMaxLength) {

  // グローバル期限と個別ジョブの再投入で同じ遅延を使う
  public Duration sendRetryDelay() {
    return FractionalSeconds.toDuration(sendRetryDelayNumberOfSeconds);
  }
}
