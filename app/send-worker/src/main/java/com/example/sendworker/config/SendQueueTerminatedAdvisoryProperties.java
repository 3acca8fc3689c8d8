/*
 * どこで: Send Worker の設定バインド
 * 何を: 送信キュー consumer の MSG_TERMINATED advisory の subject/stream/durable を保持する
 * なぜ: 復元不能で TERM したメッセージを記録する購読先を明示するため
 */
package com.example.sendworker.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "send.queue.terminated-advisory")
@Validated
public record SendQueueTerminatedAdvisoryProperties(
        @NotBlank String subject,
        @NotBlank String stream,
        @NotBlank String durable) {
}
