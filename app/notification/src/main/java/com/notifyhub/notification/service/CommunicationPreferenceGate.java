/*
 * どこで: Notification サービス層
 * 何を: 受信者のチャネル opt-out を enqueue 前に判定する
 * なぜ: 拒否されたチャネルのジョブを 1 行も書かないため
 */
package com.notifyhub.notification.service;

import com.notifyhub.notification.model.NotificationChannel;
import com.notifyhub.notification.repository.CommunicationPreferenceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CommunicationPreferenceGate {

  private final CommunicationPreferenceRepository preferenceRepository;

  public boolean allows(long recipientId, NotificationChannel channel) {
    // 設定レコードが無い受信者は全チャネル許可
    return preferenceRepository
        .findByRecipientId(recipientId)
        .map(preference -> preference.allows(channel))
        .orElse(true);
  }
}
