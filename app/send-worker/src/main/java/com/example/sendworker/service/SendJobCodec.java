/*
 * どこで: Send Worker サービス層
 * 何を: SendJob と送信キューの JSON ペイロードを相互変換する
 * なぜ: 受信と遅延再投入で同じ形式を使い、再投入後も同じジョブとして扱うため
 */
package com.example.sendworker.service;

import com.example.sendworker.model.SendJob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SendJobCodec {

  private final ObjectMapper objectMapper;

  public SendJob decode(byte[] payload) {
    if (payload == null || payload.length == 0) {
      throw new SendJobDecodeException("empty send queue payload", null);
    }
    try {
      final SendJob job = objectMapper.readValue(payload, SendJob.class);
      if (job == null) {
        throw new SendJobDecodeException("send queue payload is JSON null", null);
      }
      return job;
    } catch (IOException ex) {
      // 必須項目欠落(コンストラクタの検証失敗)もここに含まれる
      throw new SendJobDecodeException("invalid send queue payload", ex);
    }
  }

  public byte[] encode(SendJob job) {
    try {
      return objectMapper.writeValueAsBytes(job);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("send job serialization failure", ex);
    }
  }
}
