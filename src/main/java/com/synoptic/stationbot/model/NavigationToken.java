package com.synoptic.stationbot.model;

/**
 * Decoded form of a menu payload. Fully reconstructible from the payload string; the
 * server keeps no session table.
 *
 * <p>Fields that do not apply to a token type are null (or 0 for {@code page}).
 *
 * @param type      token kind
 * @param listKind  list being paged, for {@link TokenType#PAGE}
 * @param regionId  parent region for station pages, region picks and station picks
 * @param stationId picked station, for {@link TokenType#PICK_STATION}
 * @param page      zero-based page, for {@link TokenType#PAGE}
 * @param reason    why decoding failed, for {@link TokenType#INVALID}
 */
public record NavigationToken(
        TokenType type,
        ListKind listKind,
        String regionId,
        String stationId,
        int page,
        String reason
) {

    public static NavigationToken regionPage(int page) {
        return new NavigationToken(TokenType.PAGE, ListKind.REGIONS, null, null, page, null);
    }

    public static NavigationToken stationPage(String regionId, int page) {
        return new NavigationToken(TokenType.PAGE, ListKind.STATIONS, regionId, null, page, null);
    }

    public static NavigationToken page(ListKind kind, String parentRegionId, int page) {
        return kind == ListKind.STATIONS ? stationPage(parentRegionId, page) : regionPage(page);
    }

    public static NavigationToken pickRegion(String regionId) {
        return new NavigationToken(TokenType.PICK_REGION, null, regionId, null, 0, null);
    }

    public static NavigationToken pickStation(String regionId, String stationId) {
        return new NavigationToken(TokenType.PICK_STATION, null, regionId, stationId, 0, null);
    }

    public static NavigationToken back() {
        return new NavigationToken(TokenType.BACK, null, null, null, 0, null);
    }

    public static NavigationToken adminReport() {
        return new NavigationToken(TokenType.ADMIN_REPORT, null, null, null, 0, null);
    }

    public static NavigationToken noop() {
        return new NavigationToken(TokenType.NOOP, null, null, null, 0, null);
    }

    public static NavigationToken invalid(String reason) {
        return new NavigationToken(TokenType.INVALID, null, null, null, 0, reason);
    }

    public boolean isValid() {
        return type != TokenType.INVALID;
    }
}
