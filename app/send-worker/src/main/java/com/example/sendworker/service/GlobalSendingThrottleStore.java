/*
 * どこで: Send Worker サービス層
 * 何を: 全ワーカー共有の「再送可能時刻(retryNotBefore)」の読み書きを抽象化する
 * なぜ: 送信先が全体でレート制限している間、各ワーカーの送信を止めるため
 */
package com.example.sendworker.service;

import java.time.Instant;
import java.util.Optional;

/**
 * Shared admission-control state read by every worker before it does any work.
 *
 * <p>Reads and writes are not coordinated: there is no lock and no compare-and-set. Two workers
 * may race on an update and the last write wins, and a reader may miss a deadline written a few
 * milliseconds earlier. The worst outcome is a handful of extra attempts against the rate-limited
 * target while a throttle window starts, which the target rejects again with a rate-limit
 * response. Implementations must not add locking on top of this contract.
 */
public interface GlobalSendingThrottleStore {

    Optional<Instant> findRetryNotBefore();

    void updateRetryNotBefore(Instant retryNotBefore);
}
