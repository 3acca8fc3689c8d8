/*
 * どこで: Send Worker のインフラ設定
 * 何を: NATS Connection を Spring 管理下に置く
 * なぜ: 送信キュー購読/advisory 購読/遅延キュー中継が同一接続を共有するため
 */
package com.example.sendworker.config;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties properties) throws IOException, InterruptedException {
        Options.Builder builder = new Options.Builder()
                .server(properties.url())
                .connectionTimeout(properties.connectionTimeout());
        if (properties.connectionName() != null && !properties.connectionName().isBlank()) {
            builder.connectionName(properties.connectionName());
        }
        return Nats.connect(builder.build());
    }
}
