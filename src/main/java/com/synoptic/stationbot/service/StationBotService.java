package com.synoptic.stationbot.service;

import com.synoptic.stationbot.model.InboundTrigger;
import com.synoptic.stationbot.model.MenuView;
import com.synoptic.stationbot.model.NavigationToken;
import com.synoptic.stationbot.model.QuotaDecision;
import com.synoptic.stationbot.model.ReferenceDocument;
import com.synoptic.stationbot.model.StationExport;
import com.synoptic.stationbot.transport.ChatTransport;
import com.synoptic.stationbot.transport.TransportException;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;

/**
 * Entry point for every inbound trigger, whichever transport delivered it.
 *
 * Flow per trigger:
 * <ol>
 *   <li>Drop it if the debounce filter has seen the same action on the same menu
 *       message within the window.</li>
 *   <li>Commands ({@code /start}, {@code /help}, admin commands) are answered directly.</li>
 *   <li>Menu selections are decoded; list navigation re-renders the menu in place.</li>
 *   <li>A station pick is gated on the quota, materialized and announced with its data
 *       interval, then delivered inside a ledger reservation so that the download is recorded only once the file went
 *       out.</li>
 * </ol>
 *
 * <p>{@link #handleTrigger} never throws. Faults are logged here and the user gets a
 * short notice where one can still be sent.
 */
@Singleton
public class StationBotService {

    private static final Logger log = LoggerFactory.getLogger(StationBotService.class);

    static final String CMD_START = "/start";
    static final String CMD_HELP = "/help";
    static final String CMD_REPORT = "/report";
    static final String CMD_USER = "/user";
    static final String CMD_USERS_COUNT = "/users_count";

    private final DebounceFilter debounce;
    private final PaginationCodec codec;
    private final NavigationService navigation;
    private final QuotaLedgerService quota;
    private final QuotaPolicy policy;
    private final ExportMaterializer materializer;
    private final ReferenceDocumentService referenceDocuments;
    private final DownloadReportService reports;
    private final ChatTransport transport;
    private final Clock clock;

    @Value("${station-bot.telegram.admin-user-id:0}")
    private long adminUserId;

    @Value("${station-bot.telegram.notify-chat-id:0}")
    private long notifyChatId;

    @Inject
    public StationBotService(DebounceFilter debounce,
                             PaginationCodec codec,
                             NavigationService navigation,
                             QuotaLedgerService quota,
                             QuotaPolicy policy,
                             ExportMaterializer materializer,
                             ReferenceDocumentService referenceDocuments,
                             DownloadReportService reports,
                             ChatTransport transport,
                             Clock clock) {
        this.debounce = debounce;
        this.codec = codec;
        this.navigation = navigation;
        this.quota = quota;
        this.policy = policy;
        this.materializer = materializer;
        this.referenceDocuments = referenceDocuments;
        this.reports = reports;
        this.transport = transport;
        this.clock = clock;
    }

    // -----------------------------------------------------------------------
    // Boundary
    // -----------------------------------------------------------------------

    /**
     * Handles one trigger end to end.
     */
    public void handleTrigger(InboundTrigger trigger) {
        try {
            dispatch(trigger);
        } catch (Exception e) {
            log.error("Trigger failed conversation={} user={} payload={}",
                    trigger.conversationId(), trigger.userId(), trigger.payload(), e);
            notifyFailure(trigger);
        }
    }

    private void dispatch(InboundTrigger trigger) {
        Instant now = clock.instant();
        if (debounce.shouldSuppress(trigger.conversationId(), trigger.messageId(), trigger.payload(), now)) {
            acknowledge(trigger);
            return;
        }

        if (trigger.isCommand()) {
            handleCommand(trigger);
            return;
        }

        NavigationToken token = codec.decode(trigger.payload());
        switch (token.type()) {
            case PICK_STATION:
                handleStationPick(trigger, token);
                break;
            case ADMIN_REPORT:
                handleAdminReport(trigger);
                break;
            case NOOP:
                acknowledge(trigger);
                break;
            default:
                // PAGE, PICK_REGION, BACK, INVALID
                MenuView view = navigation.navigate(token, isAdmin(trigger.userId()));
                transport.renderMenu(trigger.conversationId(), trigger.messageId(), view);
                acknowledge(trigger);
        }
    }

    // -----------------------------------------------------------------------
    // Commands
    // -----------------------------------------------------------------------

    private void handleCommand(InboundTrigger trigger) {
        String[] words = trigger.payload().trim().split("\\s+");
        String command = stripBotName(words[0]).toLowerCase(Locale.ROOT);
        long conversation = trigger.conversationId();

        switch (command) {
            case CMD_START:
                log.info("Start conversation={} user={}", conversation, trigger.userId());
                transport.renderMenu(conversation, null,
                        navigation.root(MenuTexts.WELCOME, isAdmin(trigger.userId())));
                break;
            case CMD_HELP:
                transport.sendText(conversation, MenuTexts.help(policy.monthlyCap()));
                break;
            case CMD_REPORT:
                if (requireAdmin(trigger)) {
                    transport.sendText(conversation, MenuTexts.dailyReport(reports.dailyReport(today())));
                }
                break;
            case CMD_USER:
                if (requireAdmin(trigger)) {
                    handleUserCommand(conversation, words);
                }
                break;
            case CMD_USERS_COUNT:
                if (requireAdmin(trigger)) {
                    transport.sendText(conversation, MenuTexts.usersCount(reports.distinctUsers()));
                }
                break;
            default:
                transport.sendText(conversation, MenuTexts.UNKNOWN_COMMAND);
        }
    }

    private void handleUserCommand(long conversation, String[] words) {
        if (words.length < 2) {
            transport.sendText(conversation, MenuTexts.USER_USAGE);
            return;
        }
        long userId;
        try {
            userId = Long.parseLong(words[1]);
        } catch (NumberFormatException e) {
            transport.sendText(conversation, MenuTexts.USER_USAGE);
            return;
        }
        String reply = reports.userStats(userId)
                .map(MenuTexts::userStats)
                .orElse("No downloads recorded for user " + userId);
        transport.sendText(conversation, reply);
    }

    private boolean requireAdmin(InboundTrigger trigger) {
        if (isAdmin(trigger.userId())) {
            return true;
        }
        log.warn("Unauthorized admin command user={} payload={}", trigger.userId(), trigger.payload());
        transport.sendText(trigger.conversationId(), MenuTexts.NOT_AUTHORIZED);
        return false;
    }

    private void handleAdminReport(InboundTrigger trigger) {
        if (!isAdmin(trigger.userId())) {
            log.warn("Unauthorized admin report request user={}", trigger.userId());
            alert(trigger, MenuTexts.NOT_AUTHORIZED);
            return;
        }
        transport.sendText(trigger.conversationId(), MenuTexts.dailyReport(reports.dailyReport(today())));
        acknowledge(trigger);
    }

    // -----------------------------------------------------------------------
    // Station pick and export
    // -----------------------------------------------------------------------

    private void handleStationPick(InboundTrigger trigger, NavigationToken token) {
        long userId = trigger.userId();
        boolean admin = isAdmin(userId);
        LocalDate today = today();

        if (!quota.canDownload(userId, today)) {
            log.warn("Quota denied user={} station={} date={}", userId, token.stationId(), today);
            alert(trigger, MenuTexts.QUOTA_DENIED);
            transport.renderMenu(trigger.conversationId(), trigger.messageId(), navigation.regionList(0, admin));
            return;
        }

        Optional<StationExport> export = materializer.materialize(token.regionId(), token.stationId());
        if (export.isEmpty()) {
            alert(trigger, MenuTexts.EXPORT_UNAVAILABLE);
            return;
        }
        StationExport file = export.get();
        transport.renderMenu(trigger.conversationId(), null, navigation.stationDetail(file));

        QuotaDecision decision;
        try {
            decision = quota.reserveAndLog(userId, trigger.displayNameOrId(), token.regionId(), token.stationId(),
                    today, () -> {
                        transport.sendDocument(trigger.conversationId(), file.fileName(), file.content(),
                                MenuTexts.exportCaption(file));
                        return true;
                    });
        } catch (TransportException e) {
            log.error("Export delivery failed user={} station={}; reservation rolled back",
                    userId, token.stationId(), e);
            alert(trigger, MenuTexts.EXPORT_FAILED);
            return;
        }

        switch (decision) {
            case COMMITTED:
                acknowledge(trigger);
                sendReferenceDocument(trigger.conversationId());
                notifyAdminChat(trigger, file);
                transport.renderMenu(trigger.conversationId(), trigger.messageId(), navigation.regionList(0, admin));
                break;
            case DENIED:
                log.warn("Reservation denied user={} station={} date={}", userId, token.stationId(), today);
                alert(trigger, MenuTexts.QUOTA_DENIED);
                transport.renderMenu(trigger.conversationId(), trigger.messageId(), navigation.regionList(0, admin));
                break;
            default:
                alert(trigger, MenuTexts.EXPORT_FAILED);
        }
    }

    private void sendReferenceDocument(long conversation) {
        Optional<ReferenceDocument> doc = referenceDocuments.document();
        try {
            if (doc.isEmpty()) {
                transport.sendText(conversation, MenuTexts.REFERENCE_DOCUMENT_MISSING);
                return;
            }
            transport.sendDocument(conversation, doc.get().fileName(), doc.get().content(), null);
        } catch (TransportException e) {
            log.warn("Reference document not delivered conversation={}", conversation, e);
        }
    }

    private void notifyAdminChat(InboundTrigger trigger, StationExport file) {
        if (notifyChatId == 0L) {
            return;
        }
        try {
            transport.sendText(notifyChatId, MenuTexts.adminNotice(trigger.displayNameOrId(), trigger.userId(), file));
        } catch (TransportException e) {
            log.warn("Admin notification not delivered chat={}", notifyChatId, e);
        }
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    boolean isAdmin(long userId) {
        return adminUserId != 0L && adminUserId == userId;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private void acknowledge(InboundTrigger trigger) {
        if (trigger.callbackId() != null) {
            transport.acknowledge(trigger.callbackId());
        }
    }

    /**
     * Pop-up for menu selections, a plain message otherwise.
     */
    private void alert(InboundTrigger trigger, String text) {
        if (trigger.callbackId() != null) {
            transport.showAlert(trigger.callbackId(), text);
        } else {
            transport.sendText(trigger.conversationId(), text);
        }
    }

    private void notifyFailure(InboundTrigger trigger) {
        try {
            alert(trigger, MenuTexts.INTERNAL_ERROR);
        } catch (RuntimeException e) {
            log.warn("Could not tell conversation={} about the failure", trigger.conversationId(), e);
        }
    }

    private static String stripBotName(String command) {
        int at = command.indexOf('@');
        return at < 0 ? command : command.substring(0, at);
    }
}
