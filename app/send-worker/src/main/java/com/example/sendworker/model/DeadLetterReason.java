/*
 * どこで: Send Worker ドメインモデル
 * 何を: 送信キューのメッセージが dead-letter になった経路
 * なぜ: 再配信上限の到達と復元不能による TERM を区別して記録/観測するため
 */
package com.example.sendworker.model;

public enum DeadLetterReason {
    MAX_DELIVERIES("max_deliveries"),
    TERMINATED("terminated");

    private final String code;

    DeadLetterReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
