package com.synoptic.stationbot.transport;

import com.synoptic.stationbot.model.MenuView;

/**
 * Outbound side of the chat service.
 *
 * <p>Implementations raise {@link TransportException} when a call does not reach the
 * user. Callers decide whether that aborts the surrounding work; implementations never
 * retry on their own.
 */
public interface ChatTransport {

    /**
     * Shows a menu. With a {@code messageId} the existing menu message is replaced in
     * place, otherwise a new message is sent.
     *
     * @return id of the message now holding the menu, or null if the transport has none
     */
    Integer renderMenu(long conversationId, Integer messageId, MenuView view);

    void sendText(long conversationId, String text);

    /**
     * Sends a file attachment.
     *
     * @param caption optional text shown with the file, may be null
     */
    void sendDocument(long conversationId, String fileName, byte[] content, String caption);

    /**
     * Shows a short pop-up answering a menu selection.
     */
    void showAlert(String callbackId, String text);

    /**
     * Answers a menu selection without showing anything.
     */
    void acknowledge(String callbackId);
}
