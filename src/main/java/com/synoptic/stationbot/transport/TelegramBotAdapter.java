package com.synoptic.stationbot.transport;

import com.synoptic.stationbot.model.InboundTrigger;
import com.synoptic.stationbot.model.MenuButton;
import com.synoptic.stationbot.model.MenuView;
import com.synoptic.stationbot.service.StationBotService;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.runtime.event.annotation.EventListener;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Provider;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.MaybeInaccessibleMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.BotSession;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Telegram long-polling adapter.
 *
 * <p>Inbound: text messages and callback queries are turned into {@link InboundTrigger}s
 * and handed to {@link StationBotService} on a bounded worker pool, so a slow export
 * does not hold up the polling thread. When all workers are busy and
 * {@code worker-queue-capacity} updates are already waiting, further updates are dropped.
 *
 * <p>Callbacks on menus older than 48 hours carry an inaccessible message; its chat and
 * message ids are still enough to answer them.
 *
 * <p>Outbound: implements {@link ChatTransport} with inline keyboards. Item buttons are
 * laid out {@code buttons-per-row} to a row, controls share one row below them.
 *
 * <p>Active only with {@code station-bot.telegram.enabled=true}.
 */
@Singleton
@Requires(property = "station-bot.telegram.enabled", value = "true")
public class TelegramBotAdapter extends TelegramLongPollingBot implements ChatTransport {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotAdapter.class);

    private static final String NOT_MODIFIED = "message is not modified";

    private final Provider<StationBotService> service;
    private final String username;
    private final int buttonsPerRow;
    private final ExecutorService workers;

    private volatile BotSession session;

    @Inject
    public TelegramBotAdapter(Provider<StationBotService> service,
                              @Value("${station-bot.telegram.token}") String token,
                              @Value("${station-bot.telegram.username:}") String username,
                              @Value("${station-bot.telegram.buttons-per-row:2}") int buttonsPerRow,
                              @Value("${station-bot.telegram.worker-threads:8}") int workerThreads,
                              @Value("${station-bot.telegram.worker-queue-capacity:256}") int queueCapacity) {
        super(token);
        this.service = service;
        this.username = username;
        this.buttonsPerRow = Math.max(1, buttonsPerRow);
        int threads = Math.max(1, workerThreads);
        this.workers = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)), new WorkerThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @EventListener
    void onStartup(StartupEvent event) {
        try {
            TelegramBotsApi api = new TelegramBotsApi(DefaultBotSession.class);
            session = api.registerBot(this);
            log.info("Telegram bot {} registered; long polling started", username);
        } catch (TelegramApiException e) {
            log.error("Telegram bot registration failed", e);
            throw new TransportException("Cannot register Telegram bot", e);
        }
    }

    @PreDestroy
    void shutdown() {
        if (session != null && session.isRunning()) {
            session.stop();
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Telegram workers did not finish within 10s; forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Telegram bot stopped");
    }

    @Override
    public String getBotUsername() {
        return username;
    }

    // -----------------------------------------------------------------------
    // Inbound
    // -----------------------------------------------------------------------

    @Override
    public void onUpdateReceived(Update update) {
        InboundTrigger trigger = toTrigger(update);
        if (trigger == null) {
            return;
        }
        try {
            workers.execute(() -> service.get().handleTrigger(trigger));
        } catch (RejectedExecutionException e) {
            log.warn("Dropping update {} from conversation={}; worker pool is saturated or shut down",
                    update.getUpdateId(), trigger.conversationId());
        }
    }

    static InboundTrigger toTrigger(Update update) {
        if (update.hasCallbackQuery()) {
            CallbackQuery cq = update.getCallbackQuery();
            MaybeInaccessibleMessage menu = cq.getMessage();
            if (menu == null || cq.getData() == null) {
                return null;
            }
            return new InboundTrigger(menu.getChatId(), menu.getMessageId(), cq.getFrom().getId(),
                    displayName(cq.getFrom()), cq.getData(), cq.getId());
        }
        if (update.hasMessage() && update.getMessage().hasText()) {
            Message msg = update.getMessage();
            if (msg.getFrom() == null) {
                return null;
            }
            return new InboundTrigger(msg.getChatId(), null, msg.getFrom().getId(),
                    displayName(msg.getFrom()), msg.getText().trim(), null);
        }
        return null;
    }

    private static String displayName(User user) {
        if (user.getUserName() != null && !user.getUserName().isBlank()) {
            return user.getUserName();
        }
        return user.getFirstName();
    }

    // -----------------------------------------------------------------------
    // ChatTransport
    // -----------------------------------------------------------------------

    @Override
    public Integer renderMenu(long conversationId, Integer messageId, MenuView view) {
        InlineKeyboardMarkup keyboard = keyboard(view);
        if (messageId == null) {
            SendMessage msg = new SendMessage();
            msg.setChatId(String.valueOf(conversationId));
            msg.setText(view.text());
            if (!keyboard.getKeyboard().isEmpty()) {
                msg.setReplyMarkup(keyboard);
            }
            try {
                return execute(msg).getMessageId();
            } catch (TelegramApiException e) {
                throw new TransportException("sendMessage failed for chat " + conversationId, e);
            }
        }

        EditMessageText edit = new EditMessageText();
        edit.setChatId(String.valueOf(conversationId));
        edit.setMessageId(messageId);
        edit.setText(view.text());
        if (!keyboard.getKeyboard().isEmpty()) {
            edit.setReplyMarkup(keyboard);
        }
        try {
            execute(edit);
        } catch (TelegramApiException e) {
            if (isNotModified(e)) {
                log.debug("Menu unchanged chat={} message={}", conversationId, messageId);
            } else {
                throw new TransportException("editMessageText failed for chat " + conversationId, e);
            }
        }
        return messageId;
    }

    @Override
    public void sendText(long conversationId, String text) {
        SendMessage msg = new SendMessage();
        msg.setChatId(String.valueOf(conversationId));
        msg.setText(text);
        try {
            execute(msg);
        } catch (TelegramApiException e) {
            throw new TransportException("sendMessage failed for chat " + conversationId, e);
        }
    }

    @Override
    public void sendDocument(long conversationId, String fileName, byte[] content, String caption) {
        SendDocument doc = new SendDocument();
        doc.setChatId(String.valueOf(conversationId));
        doc.setDocument(new InputFile(new ByteArrayInputStream(content), fileName));
        if (caption != null) {
            doc.setCaption(caption);
        }
        try {
            execute(doc);
            log.info("Sent document {} ({} bytes) to chat={}", fileName, content.length, conversationId);
        } catch (TelegramApiException e) {
            throw new TransportException("sendDocument failed for chat " + conversationId, e);
        }
    }

    @Override
    public void showAlert(String callbackId, String text) {
        AnswerCallbackQuery answer = new AnswerCallbackQuery();
        answer.setCallbackQueryId(callbackId);
        answer.setText(text);
        answer.setShowAlert(true);
        try {
            execute(answer);
        } catch (TelegramApiException e) {
            throw new TransportException("answerCallbackQuery failed for " + callbackId, e);
        }
    }

    @Override
    public void acknowledge(String callbackId) {
        AnswerCallbackQuery answer = new AnswerCallbackQuery();
        answer.setCallbackQueryId(callbackId);
        try {
            execute(answer);
        } catch (TelegramApiException e) {
            // an expired callback only leaves the client spinner running
            log.warn("Callback {} not acknowledged: {}", callbackId, e.getMessage());
        }
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    InlineKeyboardMarkup keyboard(MenuView view) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        List<InlineKeyboardButton> row = new ArrayList<>();
        for (MenuButton item : view.items()) {
            row.add(button(item));
            if (row.size() == buttonsPerRow) {
                rows.add(row);
                row = new ArrayList<>();
            }
        }
        if (!row.isEmpty()) {
            rows.add(row);
        }
        if (!view.controls().isEmpty()) {
            List<InlineKeyboardButton> controls = new ArrayList<>();
            for (MenuButton control : view.controls()) {
                controls.add(button(control));
            }
            rows.add(controls);
        }
        InlineKeyboardMarkup markup = new InlineKeyboardMarkup();
        markup.setKeyboard(rows);
        return markup;
    }

    private static InlineKeyboardButton button(MenuButton b) {
        InlineKeyboardButton button = new InlineKeyboardButton();
        button.setText(b.label());
        button.setCallbackData(b.payload());
        return button;
    }

    private static boolean isNotModified(TelegramApiException e) {
        if (e instanceof TelegramApiRequestException req && req.getApiResponse() != null) {
            return req.getApiResponse().contains(NOT_MODIFIED);
        }
        return e.getMessage() != null && e.getMessage().contains(NOT_MODIFIED);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "telegram-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
