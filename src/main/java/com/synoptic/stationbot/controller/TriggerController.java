package com.synoptic.stationbot.controller;

import com.synoptic.stationbot.model.InboundTrigger;
import com.synoptic.stationbot.service.StationBotService;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Status;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP ingress for triggers, for transports that push instead of long polling.
 *
 * Base path: {@code /api/triggers}
 */
@Controller("/api/triggers")
public class TriggerController {

    private static final Logger log = LoggerFactory.getLogger(TriggerController.class);

    @Inject
    private StationBotService stationBotService;

    /**
     * Handles one trigger. Returns HTTP 202 Accepted; the outcome is reported to the
     * user through the chat transport, not in the response.
     *
     * @param trigger the validated trigger body
     */
    @Post
    @Status(HttpStatus.ACCEPTED)
    @ExecuteOn(TaskExecutors.BLOCKING)
    public void handleTrigger(@Body @Valid InboundTrigger trigger) {
        log.info("POST /api/triggers conversation={} user={} payload={}",
                trigger.conversationId(), trigger.userId(), trigger.payload());
        stationBotService.handleTrigger(trigger);
    }
}
