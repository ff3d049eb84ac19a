/*
 * どこで: Notification サービス層
 * 何を: 外部プロデューサが呼ぶ enqueue 契約を定義する
 * なぜ: 登録フローや記事公開フローに DI で渡せる単一の入口にするため
 */
package com.notifyhub.notification.service;

import com.notifyhub.notification.model.NotificationChannel;
import java.util.Map;
import java.util.OptionalLong;

public interface NotificationBackend {

  String DEFAULT_NOTIFICATION_TYPE = "general";

  /**
   * 通知ジョブを 1 件登録する。
   *
   * @return 登録したジョブ ID。受信者の設定で拒否された場合は empty (エラーではない)
   * @throws InvalidNotificationRequestException 入力が不正な場合
   * @throws org.springframework.dao.DataAccessException 永続化に失敗した場合
   */
  OptionalLong enqueue(
      long recipientId,
      NotificationChannel channel,
      Map<String, Object> messageData,
      String notificationType);
}
