package com.synoptic.stationbot.model;

import java.util.List;

/**
 * Transport-neutral description of a screen. How the buttons are laid out is up to the
 * transport.
 *
 * @param state     screen this view renders
 * @param text      message text
 * @param items     list entries of the current page (regions or stations)
 * @param controls  paging and back controls, rendered after the items
 * @param page      zero-based page actually shown (after clamping)
 * @param pageCount total number of pages, at least 1
 * @param regionId  parent region for station lists, otherwise null
 */
public record MenuView(
        MenuState state,
        String text,
        List<MenuButton> items,
        List<MenuButton> controls,
        int page,
        int pageCount,
        String regionId
) {

    public MenuView {
        items = List.copyOf(items);
        controls = List.copyOf(controls);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
