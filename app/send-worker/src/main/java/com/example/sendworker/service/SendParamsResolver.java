/*
 * どこで: Send Worker サービス層
 * 何を: ジョブから送信パラメータを解決する抽象化インターフェース
 * なぜ: 送信先の会話作成など外部連携の実装を差し替え可能にするため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.SendJob;
import com.example.sendworker.model.SendParams;

public interface SendParamsResolver {

    // forceStop=true は解決側で記録/再投入済みを表す。呼び出し側はそれ以上副作用を起こさない
    SendParams resolve(SendJob job);
}
