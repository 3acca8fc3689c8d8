/*
 * どこで: Send Worker ドメインモデル
 * 何を: 1 回の処理結果をキューへどう返すかを表す
 * なぜ: 再配信/dead-letter の判断をキュー基盤側に残し、例外の再送出に頼らないため
 */
package com.example.sendworker.model;

public enum InvocationDecision {
  // 消費完了として ack する
  ACK,
  // 失敗として返し、キューに再配信か dead-letter を任せる
  RETRY_OR_DEAD_LETTER
}
