package com.synoptic.stationbot.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog lookup structure built from one aggregated scan of the dataset.
 *
 * <p>Instances are never mutated after construction. A reload builds a new snapshot and
 * publishes it as a whole, so readers holding a reference always see a consistent
 * catalog and need no locking.
 *
 * <p>Invariants:
 * <ul>
 *   <li>every station's region id is present in {@link #regions()}</li>
 *   <li>regions and the stations of each region are ordered by display name, then id</li>
 *   <li>station ids are unique within a region</li>
 *   <li>a (region, station) pair without dated rows has no validity interval</li>
 * </ul>
 */
public final class CatalogSnapshot {

    private static final Comparator<Region> REGION_ORDER =
            Comparator.comparing(Region::name).thenComparing(Region::id);

    private static final Comparator<Station> STATION_ORDER =
            Comparator.comparing(Station::name).thenComparing(Station::id);

    private static final CatalogSnapshot EMPTY = new CatalogSnapshot(0L, Instant.EPOCH, List.of(), Map.of());

    private final long generation;
    private final Instant builtAt;
    private final List<Region> regions;
    private final Map<String, Region> regionsById;
    private final Map<String, List<Station>> stationsByRegion;
    private final Map<String, Map<String, Station>> stationIndex;

    private CatalogSnapshot(long generation,
                            Instant builtAt,
                            List<Region> regions,
                            Map<String, List<Station>> stationsByRegion) {
        this.generation = generation;
        this.builtAt = builtAt;
        this.regions = List.copyOf(regions);

        Map<String, Region> byId = new HashMap<>();
        for (Region r : this.regions) {
            byId.put(r.id(), r);
        }
        this.regionsById = Collections.unmodifiableMap(byId);

        Map<String, List<Station>> lists = new HashMap<>();
        Map<String, Map<String, Station>> index = new HashMap<>();
        for (Map.Entry<String, List<Station>> e : stationsByRegion.entrySet()) {
            lists.put(e.getKey(), List.copyOf(e.getValue()));
            Map<String, Station> perRegion = new HashMap<>();
            for (Station s : e.getValue()) {
                perRegion.put(s.id(), s);
            }
            index.put(e.getKey(), Collections.unmodifiableMap(perRegion));
        }
        this.stationsByRegion = Collections.unmodifiableMap(lists);
        this.stationIndex = Collections.unmodifiableMap(index);
    }

    /**
     * Returns the catalog with no regions. Served when the dataset cannot be read.
     */
    public static CatalogSnapshot empty() {
        return EMPTY;
    }

    /**
     * Builds a snapshot from aggregated catalog rows.
     *
     * <p>Rows without a region or station id are skipped. When the same (region, station)
     * pair appears more than once, the first name seen wins and the date ranges are merged.
     *
     * @param rows       aggregated (region, station, min date, max date) rows in any order
     * @param generation monotonically increasing build number
     * @param builtAt    build completion time
     * @return a new immutable snapshot
     */
    public static CatalogSnapshot fromRows(List<CatalogRow> rows, long generation, Instant builtAt) {
        Map<String, Region> regions = new LinkedHashMap<>();
        Map<String, Map<String, Station>> stations = new LinkedHashMap<>();

        for (CatalogRow row : rows) {
            if (isBlank(row.regionId()) || isBlank(row.stationId())) {
                continue;
            }
            regions.putIfAbsent(row.regionId(), new Region(row.regionId(), nameOrId(row.regionName(), row.regionId())));

            ValidityInterval interval = toInterval(row.minDate(), row.maxDate());
            Map<String, Station> perRegion = stations.computeIfAbsent(row.regionId(), k -> new LinkedHashMap<>());
            Station existing = perRegion.get(row.stationId());
            if (existing == null) {
                perRegion.put(row.stationId(), new Station(row.stationId(),
                        nameOrId(row.stationName(), row.stationId()), row.regionId(), interval));
            } else if (interval != null) {
                ValidityInterval merged = existing.validity() == null ? interval : existing.validity().span(interval);
                perRegion.put(row.stationId(), new Station(existing.id(), existing.name(), existing.regionId(), merged));
            }
        }

        List<Region> orderedRegions = new ArrayList<>(regions.values());
        orderedRegions.sort(REGION_ORDER);

        Map<String, List<Station>> orderedStations = new HashMap<>();
        for (Map.Entry<String, Map<String, Station>> e : stations.entrySet()) {
            List<Station> list = new ArrayList<>(e.getValue().values());
            list.sort(STATION_ORDER);
            orderedStations.put(e.getKey(), list);
        }

        return new CatalogSnapshot(generation, builtAt, orderedRegions, orderedStations);
    }

    public long generation() {
        return generation;
    }

    public Instant builtAt() {
        return builtAt;
    }

    /** Regions in display order. */
    public List<Region> regions() {
        return regions;
    }

    public Optional<Region> region(String regionId) {
        return Optional.ofNullable(regionId == null ? null : regionsById.get(regionId));
    }

    /**
     * Stations of a region in display order; empty when the region is unknown.
     */
    public List<Station> stations(String regionId) {
        if (regionId == null) {
            return List.of();
        }
        return stationsByRegion.getOrDefault(regionId, List.of());
    }

    public Optional<Station> station(String regionId, String stationId) {
        if (regionId == null || stationId == null) {
            return Optional.empty();
        }
        Map<String, Station> perRegion = stationIndex.get(regionId);
        return Optional.ofNullable(perRegion == null ? null : perRegion.get(stationId));
    }

    /**
     * Date range with data for the pair, or empty when the pair is unknown or has no
     * dated rows.
     */
    public Optional<ValidityInterval> validity(String regionId, String stationId) {
        return station(regionId, stationId).map(Station::validity);
    }

    public int regionCount() {
        return regions.size();
    }

    public int stationCount() {
        int total = 0;
        for (List<Station> list : stationsByRegion.values()) {
            total += list.size();
        }
        return total;
    }

    public boolean isEmpty() {
        return regions.isEmpty();
    }

    private static ValidityInterval toInterval(LocalDate min, LocalDate max) {
        if (min == null || max == null) {
            return null;
        }
        return max.isBefore(min) ? new ValidityInterval(max, min) : new ValidityInterval(min, max);
    }

    private static String nameOrId(String name, String id) {
        return isBlank(name) ? id : name;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        return "CatalogSnapshot{generation=" + generation
                + ", regions=" + regions.size()
                + ", stations=" + stationCount()
                + ", builtAt=" + builtAt + '}';
    }
}
