package com.agilab.log_collecting.notification;

import com.agilab.log_collecting.config.LogCollectorProperties;
import com.agilab.log_collecting.event.CollectionCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Publishes collection outcomes. Nothing is sent while no binding is configured.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CollectionNotificationProducer {

    private final StreamBridge streamBridge;
    private final LogCollectorProperties properties;

    public boolean sendCompletion(CollectionCompletedEvent event) {
        var binding = Optional.ofNullable(properties.getNotificationBinding()).filter(StringUtils::isNotBlank);
        if (binding.isEmpty()) {
            log.debug("No notification binding configured, skipping completion event for {}", event.source());
            return false;
        }
        return binding.filter(bin -> sendToBinding(bin, event)).isPresent();
    }

    private boolean sendToBinding(String binding, CollectionCompletedEvent event) {
        try {
            var sent = streamBridge.send(binding, event);
            if (!sent) {
                log.error("Failed to send completion event to binding {}: {}", binding, event.source());
            }
            return sent;
        } catch (Exception e) {
            log.error("Error sending completion event to binding {}: {}", binding, event.source(), e);
            return false;
        }
    }
}
