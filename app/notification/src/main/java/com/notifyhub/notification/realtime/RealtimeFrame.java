/*
 * どこで: Notification realtime 層
 * 何を: サーバからクライアントへ送る JSON フレームを表す
 * なぜ: ライブ配信と未読リプレイで同じ形 {type, data, job_id} を使うため
 */
package com.notifyhub.notification.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RealtimeFrame(String type, JsonNode data, Long jobId) {

  public static final String TYPE_NOTIFICATION = "notification";
  public static final String TYPE_NOTIFICATION_MISSED = "notification_missed";

  public static RealtimeFrame notification(JsonNode data, Long jobId) {
    return new RealtimeFrame(TYPE_NOTIFICATION, data, jobId);
  }

  public static RealtimeFrame missed(JsonNode data, long jobId) {
    return new RealtimeFrame(TYPE_NOTIFICATION_MISSED, data, jobId);
  }
}
