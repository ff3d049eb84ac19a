/*
 * どこで: Notification 配信ハンドラ
 * 何を: 宛先を解決し plain + 任意の HTML の multipart メールを送る
 * なぜ: SMTP 送信を JavaMailSender に委ね、失敗を DeliveryException に揃えるため
 */
package com.notifyhub.notification.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import com.notifyhub.notification.config.NotificationEmailProperties;
import com.notifyhub.notification.model.NotificationChannel;
import com.notifyhub.notification.repository.RecipientContactRepository;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailDeliveryHandler implements DeliveryHandler {

  private static final Logger logger = LoggerFactory.getLogger(EmailDeliveryHandler.class);
  static final String DEFAULT_SUBJECT = "No Subject";
  static final String DEFAULT_BODY_TEXT = "No text content.";

  private final JavaMailSender mailSender;
  private final RecipientContactRepository contactRepository;
  private final NotificationEmailProperties properties;

  @Override
  public String channel() {
    return NotificationChannel.EMAIL.value();
  }

  @Override
  public void send(long recipientId, JsonNode messageData, long jobId) {
    final String to =
        contactRepository
            .findEmailAddress(recipientId)
            .orElseThrow(
                () ->
                    new DeliveryException(
                        "no email address registered for recipient " + recipientId));
    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      // multipart/alternative: plain を必須、HTML は任意
      MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
      helper.setFrom(properties.fromAddress());
      helper.setTo(to);
      helper.setSubject(text(messageData, "subject", DEFAULT_SUBJECT));
      String plain = text(messageData, "body_text", DEFAULT_BODY_TEXT);
      String html = text(messageData, "body_html", null);
      if (html != null) {
        helper.setText(plain, html);
      } else {
        helper.setText(plain, false);
      }
      mailSender.send(mimeMessage);
      logger.info("email sent jobId={} recipientId={}", jobId, recipientId);
    } catch (MailException | MessagingException ex) {
      logger.warn(
          "failed to send email jobId={} recipientId={} reason={}",
          jobId,
          recipientId,
          ex.getMessage());
      throw new DeliveryException("email transport failed: " + ex.getMessage(), ex);
    }
  }

  private String text(JsonNode messageData, String field, String fallback) {
    if (messageData == null) {
      return fallback;
    }
    JsonNode node = messageData.get(field);
    if (node == null || node.isNull()) {
      return fallback;
    }
    String value = node.asText();
    return value.isEmpty() ? fallback : value;
  }
}
