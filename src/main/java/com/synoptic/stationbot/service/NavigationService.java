package com.synoptic.stationbot.service;

import com.synoptic.stationbot.model.CatalogSnapshot;
import com.synoptic.stationbot.model.ListKind;
import com.synoptic.stationbot.model.MenuButton;
import com.synoptic.stationbot.model.MenuState;
import com.synoptic.stationbot.model.MenuView;
import com.synoptic.stationbot.model.NavigationToken;
import com.synoptic.stationbot.model.Region;
import com.synoptic.stationbot.model.Station;
import com.synoptic.stationbot.model.StationExport;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Menu state machine.
 *
 * <p>Every screen is computed from a navigation token and the live catalog snapshot,
 * nothing else. Requested pages outside the current list are clamped into range, so a
 * token minted against an older, longer catalog still lands on a real page.
 *
 * <pre>
 *   RootMenu          --entry--------&gt; RegionList(0)
 *   RegionList(p)     --page---------&gt; RegionList(p')
 *   RegionList(p)     --pick region--&gt; StationList(r, 0)
 *   StationList(r, p) --page---------&gt; StationList(r, p')
 *   StationList(r, p) --back---------&gt; RegionList(0)
 *   StationList(r, p) --pick station-&gt; StationDetail(r, s)   (export flow, then RegionList(0))
 * </pre>
 * The station pick itself is handled by {@link StationBotService}, which gates it on
 * the quota ledger.
 */
@Singleton
public class NavigationService {

    private static final Logger log = LoggerFactory.getLogger(NavigationService.class);

    private final CatalogIndexService catalog;
    private final PaginationCodec codec;
    private final int pageSize;

    @Inject
    public NavigationService(CatalogIndexService catalog,
                             PaginationCodec codec,
                             @Value("${station-bot.menu.page-size:16}") int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("page size must be positive: " + pageSize);
        }
        this.catalog = catalog;
        this.codec = codec;
        this.pageSize = pageSize;
    }

    // -----------------------------------------------------------------------
    // Entry points
    // -----------------------------------------------------------------------

    /**
     * Root menu entry: the first page of the region list, headed by {@code greeting}.
     */
    public MenuView root(String greeting, boolean admin) {
        return regionList(catalog.snapshot(), 0, admin, greeting);
    }

    /**
     * Screen for a decoded menu token. Station picks, admin reports and no-ops are not
     * screen transitions and are rejected; invalid tokens fall back to the root menu.
     */
    public MenuView navigate(NavigationToken token, boolean admin) {
        CatalogSnapshot snapshot = catalog.snapshot();
        switch (token.type()) {
            case PAGE:
                if (token.listKind() == ListKind.STATIONS) {
                    return stationList(snapshot, token.regionId(), token.page(), admin);
                }
                return regionList(snapshot, token.page(), admin, null);
            case PICK_REGION:
                return stationList(snapshot, token.regionId(), 0, admin);
            case BACK:
                return regionList(snapshot, 0, admin, null);
            case INVALID:
                log.warn("Invalid navigation token reason={}; showing root menu", token.reason());
                return regionList(snapshot, 0, admin, MenuTexts.MENU_EXPIRED);
            default:
                throw new IllegalArgumentException("Not a navigation transition: " + token.type());
        }
    }

    public MenuView regionList(int page, boolean admin) {
        return regionList(catalog.snapshot(), page, admin, null);
    }

    public MenuView stationList(String regionId, int page, boolean admin) {
        return stationList(catalog.snapshot(), regionId, page, admin);
    }

    /**
     * Station detail shown once a pick has been materialized: station and data interval,
     * no buttons. The flow returns to the first region page after the export.
     */
    public MenuView stationDetail(StationExport export) {
        return new MenuView(MenuState.STATION_DETAIL, MenuTexts.stationDetail(export),
                List.of(), List.of(), 0, 1, export.regionId());
    }

    public int pageSize() {
        return pageSize;
    }

    // -----------------------------------------------------------------------
    // Screens
    // -----------------------------------------------------------------------

    private MenuView regionList(CatalogSnapshot snapshot, int requestedPage, boolean admin, String heading) {
        List<Region> regions = snapshot.regions();
        int pageCount = pageCount(regions.size());
        int page = clamp(requestedPage, pageCount);

        List<MenuButton> items = new ArrayList<>();
        for (Region region : slice(regions, page)) {
            button(region.name(), () -> codec.encodePickRegion(region.id())).ifPresent(items::add);
        }

        List<MenuButton> controls = new ArrayList<>(pagingControls(ListKind.REGIONS, null, page, pageCount));
        if (admin) {
            controls.add(new MenuButton(MenuTexts.BUTTON_ADMIN_REPORT, codec.encodeAdminReport()));
        }

        String body = regions.isEmpty() ? MenuTexts.NO_REGIONS : MenuTexts.CHOOSE_REGION;
        String text = heading == null ? body : heading + "\n\n" + body;
        return new MenuView(MenuState.REGION_LIST, text, items, controls, page, pageCount, null);
    }

    private MenuView stationList(CatalogSnapshot snapshot, String regionId, int requestedPage, boolean admin) {
        Optional<Region> region = snapshot.region(regionId);
        if (region.isEmpty()) {
            // region vanished in a reload since the token was minted
            log.warn("Unknown region={} in catalog generation={}; showing root menu",
                    regionId, snapshot.generation());
            return regionList(snapshot, 0, admin, MenuTexts.MENU_EXPIRED);
        }

        List<Station> stations = snapshot.stations(regionId);
        int pageCount = pageCount(stations.size());
        int page = clamp(requestedPage, pageCount);

        List<MenuButton> items = new ArrayList<>();
        for (Station station : slice(stations, page)) {
            button(station.name(), () -> codec.encodePickStation(regionId, station.id())).ifPresent(items::add);
        }

        List<MenuButton> controls = new ArrayList<>(pagingControls(ListKind.STATIONS, regionId, page, pageCount));
        controls.add(new MenuButton(MenuTexts.BUTTON_BACK, codec.encodeBack()));

        String name = region.get().name();
        String text = stations.isEmpty() ? MenuTexts.noStations(name) : MenuTexts.chooseStation(name);
        return new MenuView(MenuState.STATION_LIST, text, items, controls, page, pageCount, regionId);
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private List<MenuButton> pagingControls(ListKind kind, String regionId, int page, int pageCount) {
        if (pageCount <= 1) {
            return List.of();
        }
        List<MenuButton> controls = new ArrayList<>(3);
        if (page > 0) {
            controls.add(new MenuButton(MenuTexts.BUTTON_PREV, codec.encode(kind, regionId, page - 1)));
        }
        controls.add(new MenuButton(MenuTexts.pageIndicator(page, pageCount), codec.encodeNoop()));
        if (page < pageCount - 1) {
            controls.add(new MenuButton(MenuTexts.BUTTON_NEXT, codec.encode(kind, regionId, page + 1)));
        }
        return controls;
    }

    private <T> List<T> slice(List<T> all, int page) {
        int from = Math.min(page * pageSize, all.size());
        int to = Math.min(from + pageSize, all.size());
        return all.subList(from, to);
    }

    int pageCount(int size) {
        return Math.max(1, (size + pageSize - 1) / pageSize);
    }

    static int clamp(int page, int pageCount) {
        if (page < 0) {
            return 0;
        }
        return Math.min(page, pageCount - 1);
    }

    /**
     * Identifiers whose payload exceeds the transport limit cannot be offered; such an
     * entry is left out of the menu and logged.
     */
    private static Optional<MenuButton> button(String label, Supplier<String> payload) {
        try {
            return Optional.of(new MenuButton(label, payload.get()));
        } catch (IllegalArgumentException e) {
            log.error("Cannot offer menu entry '{}': {}", label, e.getMessage());
            return Optional.empty();
        }
    }
}
