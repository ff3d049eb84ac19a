/*
 * どこで: Notification 配信ハンドラ
 * 何を: channel 文字列から DeliveryHandler を引く静的な対応表を持つ
 * なぜ: 未知チャネルをリトライ不能な失敗として判別するため
 */
package com.notifyhub.notification.delivery;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DeliveryHandlerRegistry {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryHandlerRegistry.class);

  private final Map<String, DeliveryHandler> handlers = new ConcurrentHashMap<>();

  public DeliveryHandlerRegistry(List<DeliveryHandler> deliveryHandlers) {
    for (DeliveryHandler handler : deliveryHandlers) {
      DeliveryHandler previous = handlers.putIfAbsent(handler.channel(), handler);
      if (previous != null) {
        throw new IllegalStateException(
            "duplicate delivery handler for channel " + handler.channel());
      }
    }
    logger.info("delivery handlers registered channels={}", handlers.keySet());
  }

  public Optional<DeliveryHandler> find(String channel) {
    if (channel == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(handlers.get(channel));
  }

  public Set<String> channels() {
    return Set.copyOf(handlers.keySet());
  }
}
