/*
 * どこで: Send Worker の設定バインド
 * 何を: 送信キュー consumer の MaxDeliver advisory の subject/stream/durable を保持する
 * なぜ: 再配信上限に達した(dead-letter)メッセージを記録する購読先を明示するため
 */
package com.example.sendworker.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "send.queue.advisory")
@Validated
public record SendQueueAdvisoryProperties(
        @NotBlank String subject,
        @NotBlank String stream,
        @NotBlank String durable) {
}
