/*
 * どこで: Send Worker サービス層
 * 何を: ジョブを遅延つきで送信キューへ戻す抽象化インターフェース
 * なぜ: 遅延再投入を新しいメッセージとして扱い、配信回数を持ち越さないため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.SendJob;
import java.time.Duration;

public interface SendQueue {
    void sendDelayed(SendJob job, Duration delay);
}
