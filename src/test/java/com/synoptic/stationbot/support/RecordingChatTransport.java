package com.synoptic.stationbot.support;

import com.synoptic.stationbot.model.MenuView;
import com.synoptic.stationbot.transport.ChatTransport;
import com.synoptic.stationbot.transport.LoggingChatTransport;
import com.synoptic.stationbot.transport.TransportException;
import io.micronaut.context.annotation.Replaces;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Captures everything the bot sends so tests can assert on it.
 */
@Singleton
@Requires(env = "test")
@Replaces(LoggingChatTransport.class)
public class RecordingChatTransport implements ChatTransport {

    public record Menu(long conversationId, Integer messageId, MenuView view) {
    }

    public record Text(long conversationId, String text) {
    }

    public record Document(long conversationId, String fileName, byte[] content, String caption) {
    }

    public record Alert(String callbackId, String text) {
    }

    public final List<Menu> menus = new CopyOnWriteArrayList<>();
    public final List<Text> texts = new CopyOnWriteArrayList<>();
    public final List<Document> documents = new CopyOnWriteArrayList<>();
    public final List<Alert> alerts = new CopyOnWriteArrayList<>();
    public final List<String> acks = new CopyOnWriteArrayList<>();

    /** When set, every document upload fails. */
    public volatile boolean failDocuments;

    private final AtomicInteger messageIds = new AtomicInteger(100);

    @Override
    public Integer renderMenu(long conversationId, Integer messageId, MenuView view) {
        int id = messageId != null ? messageId : messageIds.incrementAndGet();
        menus.add(new Menu(conversationId, id, view));
        return id;
    }

    @Override
    public void sendText(long conversationId, String text) {
        texts.add(new Text(conversationId, text));
    }

    @Override
    public void sendDocument(long conversationId, String fileName, byte[] content, String caption) {
        if (failDocuments) {
            throw new TransportException("upload rejected");
        }
        documents.add(new Document(conversationId, fileName, content, caption));
    }

    @Override
    public void showAlert(String callbackId, String text) {
        alerts.add(new Alert(callbackId, text));
    }

    @Override
    public void acknowledge(String callbackId) {
        acks.add(callbackId);
    }

    public Menu lastMenu() {
        return menus.get(menus.size() - 1);
    }

    public void clear() {
        menus.clear();
        texts.clear();
        documents.clear();
        alerts.clear();
        acks.clear();
        failDocuments = false;
    }
}
