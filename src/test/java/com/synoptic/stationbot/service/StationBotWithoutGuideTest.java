package com.synoptic.stationbot.service;

import com.synoptic.stationbot.model.InboundTrigger;
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
import java.util.Map;

import static com.synoptic.stationbot.support.DatasetFixture.*;
import static org.junit.jupiter.api.Assertions.*;

@MicronautTest(transactional = false)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class StationBotWithoutGuideTest implements TestPropertyProvider {

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
            return Map.of("station-bot.dataset.path",
                    DatasetFixture.writeParquet(Files.createTempDirectory("station-bot-noguide")).toString());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @BeforeEach
    void reset() {
        LedgerDatabase.clear(dataSource);
        transport.clear();
    }

    @Test
    void missingGuideIsAnnouncedAfterTheExport() {
        InboundTrigger pick = new InboundTrigger(901L, 3, 42L, "sara",
                codec.encodePickStation(TEHRAN, MEHRABAD), "cb-901");

        bot.handleTrigger(pick);

        assertEquals(1L, LedgerDatabase.countEvents(dataSource));
        assertEquals(1, transport.documents.size());
        assertTrue(transport.documents.get(0).fileName().endsWith(".csv"));
        assertTrue(transport.texts.stream()
                .anyMatch(t -> t.conversationId() == 901L && t.text().equals(MenuTexts.REFERENCE_DOCUMENT_MISSING)));
    }
}
