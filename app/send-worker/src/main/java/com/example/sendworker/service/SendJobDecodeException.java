/*
 * どこで: Send Worker サービス層
 * 何を: 送信キューのペイロードを SendJob に復元できないことを示す例外
 * なぜ: 再配信しても回復しないメッセージを TERM する判断に使うため
 */
package com.example.sendworker.service;

public class SendJobDecodeException extends RuntimeException {

    public SendJobDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
