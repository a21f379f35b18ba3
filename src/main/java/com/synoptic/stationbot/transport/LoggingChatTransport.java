package com.synoptic.stationbot.transport;

import com.synoptic.stationbot.model.MenuView;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport used when no chat service is connected (Telegram disabled). Replies to
 * triggers posted over HTTP are written to the log only.
 */
@Singleton
@Requires(property = "station-bot.telegram.enabled", notEquals = "true")
public class LoggingChatTransport implements ChatTransport {

    private static final Logger log = LoggerFactory.getLogger(LoggingChatTransport.class);

    private final AtomicInteger messageIds = new AtomicInteger();

    @Override
    public Integer renderMenu(long conversationId, Integer messageId, MenuView view) {
        int id = messageId != null ? messageId : messageIds.incrementAndGet();
        log.info("menu chat={} message={} state={} page={}/{} items={} text={}",
                conversationId, id, view.state(), view.page() + 1, view.pageCount(),
                view.items().size(), view.text());
        return id;
    }

    @Override
    public void sendText(long conversationId, String text) {
        log.info("text chat={} text={}", conversationId, text);
    }

    @Override
    public void sendDocument(long conversationId, String fileName, byte[] content, String caption) {
        log.info("document chat={} file={} bytes={}", conversationId, fileName, content.length);
    }

    @Override
    public void showAlert(String callbackId, String text) {
        log.info("alert callback={} text={}", callbackId, text);
    }

    @Override
    public void acknowledge(String callbackId) {
        log.debug("ack callback={}", callbackId);
    }
}
