package com.synoptic.stationbot.service;

import com.synoptic.stationbot.model.InboundTrigger;
import com.synoptic.stationbot.model.MenuButton;
import com.synoptic.stationbot.model.MenuState;
import com.synoptic.stationbot.model.MenuView;
import com.synoptic.stationbot.support.DatasetFixture;
import com.synoptic.stationbot.support.LedgerDatabase;
import com.synoptic.stationbot.support.RecordingChatTransport;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import io.micronaut.test.support.TestPropertyProvider;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static com.synoptic.stationbot.support.DatasetFixture.*;
import static org.junit.jupiter.api.Assertions.*;

@MicronautTest(transactional = false)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class StationBotFlowTest implements TestPropertyProvider {

    private static final long USER = 42L;
    private static final long EXEMPT = 7L;
    private static final long ADMIN = 1000L;
    private static final long NOTIFY_CHAT = 555L;

    private static final AtomicInteger CONVERSATIONS = new AtomicInteger(1);

    @Inject
    StationBotService bot;

    @Inject
    PaginationCodec codec;

    @Inject
    RecordingChatTransport transport;

    @Inject
    DataSource dataSource;

    @Override
    public Map<String, String> getProperties() {
        try {
            Path dir = Files.createTempDirectory("station-bot-flow");
            Path guide = Files.write(dir.resolve("guide.pdf"), new byte[]{'%', 'P', 'D', 'F'});
            return Map.of(
                    "station-bot.dataset.path", DatasetFixture.writeParquet(dir).toString(),
                    "station-bot.reference-document.path", guide.toString(),
                    "station-bot.quota.exempt-user-ids", String.valueOf(EXEMPT),
                    "station-bot.telegram.admin-user-id", String.valueOf(ADMIN),
                    "station-bot.telegram.notify-chat-id", String.valueOf(NOTIFY_CHAT));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @BeforeEach
    void reset() {
        LedgerDatabase.clear(dataSource);
        transport.clear();
    }

    private static long newConversation() {
        return CONVERSATIONS.incrementAndGet();
    }

    private static InboundTrigger command(long conversation, long user, String text) {
        return new InboundTrigger(conversation, null, user, "user" + user, text, null);
    }

    private static InboundTrigger click(long conversation, int messageId, long user, String payload) {
        return new InboundTrigger(conversation, messageId, user, "user" + user, payload,
                "cb-" + conversation + "-" + messageId + "-" + payload.hashCode());
    }

    private static List<String> labels(MenuView view) {
        return view.items().stream().map(MenuButton::label).collect(Collectors.toList());
    }

    // -----------------------------------------------------------------------
    // Navigation
    // -----------------------------------------------------------------------

    @Test
    void startThenPickTehranShowsTehranStationsSorted() {
        long chat = newConversation();

        bot.handleTrigger(command(chat, USER, "/start"));
        RecordingChatTransport.Menu start = transport.lastMenu();
        assertEquals(MenuState.REGION_LIST, start.view().state());
        assertEquals(List.of("Isfahan", "Tehran"), labels(start.view()));
        assertTrue(start.view().text().startsWith(MenuTexts.WELCOME));

        MenuButton tehran = start.view().items().get(1);
        bot.handleTrigger(click(chat, start.messageId(), USER, tehran.payload()));

        RecordingChatTransport.Menu stations = transport.lastMenu();
        assertEquals(start.messageId(), stations.messageId());
        assertEquals(MenuState.STATION_LIST, stations.view().state());
        assertEquals(List.of("Geophysic", "Mehrabad", "Shemiran"), labels(stations.view()));
    }

    @Test
    void invalidPayloadRerendersRootMenu() {
        long chat = newConversation();

        bot.handleTrigger(click(chat, 5, USER, "region|THR|page|2"));

        MenuView view = transport.lastMenu().view();
        assertEquals(MenuState.REGION_LIST, view.state());
        assertTrue(view.text().startsWith(MenuTexts.MENU_EXPIRED));
        assertEquals(1, transport.acks.size());
    }

    // -----------------------------------------------------------------------
    // Downloads
    // -----------------------------------------------------------------------

    @Test
    void firstDownloadOfTheDaySucceedsAndIsLogged() {
        long chat = newConversation();

        bot.handleTrigger(click(chat, 10, USER, codec.encodePickStation(TEHRAN, MEHRABAD)));

        assertEquals(1L, LedgerDatabase.countEvents(dataSource));
        RecordingChatTransport.Document csv = transport.documents.get(0);
        assertEquals(chat, csv.conversationId());
        assertTrue(csv.fileName().startsWith("Tehran_Mehrabad_2020-01-01_2020-01-03"));
        assertTrue(csv.caption().contains("3 rows"));

        RecordingChatTransport.Menu detail = transport.menus.stream()
                .filter(m -> m.view().state() == MenuState.STATION_DETAIL)
                .findFirst()
                .orElseThrow();
        assertTrue(detail.view().text().contains("Mehrabad"));
        assertTrue(detail.view().text().contains("2020-01-01 to 2020-01-03"));

        // reference document follows the extract
        assertEquals(2, transport.documents.size());
        assertEquals("guide.pdf", transport.documents.get(1).fileName());

        assertTrue(transport.texts.stream().anyMatch(t -> t.conversationId() == NOTIFY_CHAT
                && t.text().contains(String.valueOf(USER))));
        assertEquals(MenuState.REGION_LIST, transport.lastMenu().view().state());
    }

    @Test
    void identicalTapWithinWindowIsSuppressed() {
        long chat = newConversation();
        InboundTrigger tap = click(chat, 11, USER, codec.encodePickStation(TEHRAN, MEHRABAD));

        bot.handleTrigger(tap);
        bot.handleTrigger(tap);

        assertEquals(1L, LedgerDatabase.countEvents(dataSource));
        assertEquals(1, transport.documents.stream().filter(d -> d.fileName().endsWith(".csv")).count());
        assertTrue(transport.alerts.isEmpty());
    }

    @Test
    void secondStationSameDayIsDenied() {
        long chat = newConversation();
        bot.handleTrigger(click(chat, 12, USER, codec.encodePickStation(TEHRAN, MEHRABAD)));
        transport.clear();

        bot.handleTrigger(click(chat, 12, USER, codec.encodePickStation(TEHRAN, SHEMIRAN)));

        assertEquals(1L, LedgerDatabase.countEvents(dataSource));
        assertTrue(transport.documents.isEmpty());
        assertEquals(MenuTexts.QUOTA_DENIED, transport.alerts.get(0).text());
        assertEquals(MenuState.REGION_LIST, transport.lastMenu().view().state());
    }

    @Test
    void exemptUserDownloadsTwoStationsOnOneDay() {
        long chat = newConversation();

        bot.handleTrigger(click(chat, 13, EXEMPT, codec.encodePickStation(TEHRAN, MEHRABAD)));
        bot.handleTrigger(click(chat, 13, EXEMPT, codec.encodePickStation(TEHRAN, SHEMIRAN)));

        assertEquals(2L, LedgerDatabase.countEvents(dataSource));
        assertEquals(2, transport.documents.stream().filter(d -> d.fileName().endsWith(".csv")).count());
    }

    @Test
    void stationWithoutDataShowsNoticeAndChargesNothing() {
        long chat = newConversation();

        bot.handleTrigger(click(chat, 14, USER, codec.encodePickStation(TEHRAN, "99999")));

        assertEquals(0L, LedgerDatabase.countEvents(dataSource));
        assertEquals(MenuTexts.EXPORT_UNAVAILABLE, transport.alerts.get(0).text());
        assertTrue(transport.menus.stream().noneMatch(m -> m.view().state() == MenuState.STATION_DETAIL));
    }

    @Test
    void failedUploadLeavesQuotaUntouched() {
        long chat = newConversation();
        transport.failDocuments = true;

        bot.handleTrigger(click(chat, 15, USER, codec.encodePickStation(TEHRAN, MEHRABAD)));

        assertEquals(0L, LedgerDatabase.countEvents(dataSource));
        assertEquals(MenuTexts.EXPORT_FAILED, transport.alerts.get(0).text());

        transport.failDocuments = false;
        bot.handleTrigger(click(chat, 15, USER, codec.encodePickStation(TEHRAN, SHEMIRAN)));
        assertEquals(1L, LedgerDatabase.countEvents(dataSource));
    }

    // -----------------------------------------------------------------------
    // Commands
    // -----------------------------------------------------------------------

    @Test
    void helpDescribesTheQuota() {
        long chat = newConversation();

        bot.handleTrigger(command(chat, USER, "/help"));

        assertTrue(transport.texts.get(0).text().contains("one download per day"));
    }

    @Test
    void adminCommandsAreRefusedForOtherUsers() {
        long chat = newConversation();

        bot.handleTrigger(command(chat, USER, "/report"));
        bot.handleTrigger(command(chat, USER, "/users_count"));
        bot.handleTrigger(click(chat, 16, USER, codec.encodeAdminReport()));

        assertEquals(2, transport.texts.stream().filter(t -> t.text().equals(MenuTexts.NOT_AUTHORIZED)).count());
        assertEquals(MenuTexts.NOT_AUTHORIZED, transport.alerts.get(0).text());
    }

    @Test
    void adminReportListsTodaysDownloads() {
        bot.handleTrigger(click(newConversation(), 17, USER, codec.encodePickStation(TEHRAN, MEHRABAD)));
        long chat = newConversation();
        transport.clear();

        bot.handleTrigger(command(chat, ADMIN, "/report"));
        bot.handleTrigger(command(chat, ADMIN, "/user " + USER));
        bot.handleTrigger(command(chat, ADMIN, "/users_count"));

        List<String> replies = transport.texts.stream().map(RecordingChatTransport.Text::text)
                .collect(Collectors.toList());
        assertTrue(replies.get(0).contains(": 1"));
        assertTrue(replies.get(0).contains(MEHRABAD));
        assertTrue(replies.get(1).contains("1 downloads"));
        assertTrue(replies.get(2).endsWith("1"));
    }

    @Test
    void adminSeesReportButtonOnStart() {
        long chat = newConversation();

        bot.handleTrigger(command(chat, ADMIN, "/start"));

        List<MenuButton> controls = transport.lastMenu().view().controls();
        assertEquals(MenuTexts.BUTTON_ADMIN_REPORT, controls.get(controls.size() - 1).label());
    }

    @Test
    void unknownCommandGetsHint() {
        bot.handleTrigger(command(newConversation(), USER, "/weather"));

        assertEquals(MenuTexts.UNKNOWN_COMMAND, transport.texts.get(0).text());
    }
}
