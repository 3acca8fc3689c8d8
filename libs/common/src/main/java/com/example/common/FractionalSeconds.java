/*
 * どこで: 共通ユーティリティ
 * 何を: 小数秒の設定値を Duration に変換する
 * なぜ: 秒単位(double)で与えられる遅延設定をミリ秒精度で扱うため
 */
package com.example.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

public final class FractionalSeconds {
  private FractionalSeconds() {}

  public static Duration toDuration(double seconds) {
    if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds < 0.0d) {
      throw new IllegalArgumentException("seconds must be a finite non-negative value: " + seconds);
    }
    // 1ms 未満は切り上げ、0 より大きい遅延が 0 に潰れないようにする
    // 10 進表現で桁をずらし、double の乗算誤差(1.1 * 1000 = 1100.0000000000002)を持ち込まない
    final BigDecimal millis =
        BigDecimal.valueOf(seconds).movePointRight(3).setScale(0, RoundingMode.CEILING);
    return Duration.ofMillis(millis.longValueExact());
  }
}
