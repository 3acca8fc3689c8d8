/*
 * どこで: Send Worker アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジュールを有効化する
 * なぜ: キュー購読と遅延キュー中継を同一プロセスで動かすため
 */
package com.example.sendworker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class SendWorkerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SendWorkerApplication.class, args);
	}
}
