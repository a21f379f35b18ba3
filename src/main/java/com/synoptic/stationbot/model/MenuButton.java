package com.synoptic.stationbot.model;

/**
 * A selectable item of a rendered menu.
 *
 * @param label   text shown to the user
 * @param payload encoded navigation token delivered back when the item is selected
 */
public record MenuButton(String label, String payload) {
}
