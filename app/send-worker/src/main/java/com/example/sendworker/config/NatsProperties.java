/*
 * どこで: Send Worker の設定バインド
 * 何を: NATS 接続設定(接続先/タイムアウト/接続名)を読み込む
 * なぜ: 環境ごとの接続先を切り替え、サーバ側でワーカー接続を識別できるようにするため
 */
package com.example.sendworker.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled, String url, Duration connectionTimeout, String connectionName) {}
