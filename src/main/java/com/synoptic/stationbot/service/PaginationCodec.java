package com.synoptic.stationbot.service;

import com.synoptic.stationbot.model.ListKind;
import com.synoptic.stationbot.model.NavigationToken;
import jakarta.inject.Singleton;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Encodes navigation state into compact menu payloads and decodes them back.
 *
 * <p>Payload grammar, components separated by {@code :}:
 * <pre>
 *   v1:R:&lt;page&gt;                  region list page
 *   v1:S:&lt;region&gt;:&lt;page&gt;         station list page of a region
 *   v1:r:&lt;region&gt;                region picked
 *   v1:s:&lt;region&gt;:&lt;station&gt;      station picked
 *   v1:b                          back to region list
 *   v1:a                          admin report
 *   v1:n                          inert button
 * </pre>
 * Identifiers travel as raw UTF-8 with only {@code %} and {@code :} escaped
 * ({@code %25}, {@code %3A}), so they never contain the separator and Persian names stay
 * within the byte limit.
 *
 * <p>A payload carries everything needed to rebuild the screen; nothing is looked up
 * in server-side state. Page numbers are range-checked by the navigation layer against
 * the current catalog, not here.
 */
@Singleton
public class PaginationCodec {

    /** Callback payload limit of the chat transport, in UTF-8 bytes. */
    public static final int MAX_PAYLOAD_BYTES = 64;

    static final String VERSION = "v1";

    private static final String SEP = ":";
    private static final Pattern PAGE_PATTERN = Pattern.compile("\\d{1,10}");

    private static final String TAG_REGION_PAGE = "R";
    private static final String TAG_STATION_PAGE = "S";
    private static final String TAG_PICK_REGION = "r";
    private static final String TAG_PICK_STATION = "s";
    private static final String TAG_BACK = "b";
    private static final String TAG_ADMIN_REPORT = "a";
    private static final String TAG_NOOP = "n";

    // -----------------------------------------------------------------------
    // Encoding
    // -----------------------------------------------------------------------

    /**
     * Encodes a list page.
     *
     * @param kind           list being paged
     * @param parentRegionId region whose stations are listed; ignored for region pages
     * @param page           zero-based page, not negative
     * @throws IllegalArgumentException on a negative page, a missing parent region for a
     *                                  station page, or a payload over {@value #MAX_PAYLOAD_BYTES} bytes
     */
    public String encode(ListKind kind, String parentRegionId, int page) {
        if (page < 0) {
            throw new IllegalArgumentException("page must not be negative: " + page);
        }
        if (kind == ListKind.STATIONS) {
            requireId(parentRegionId, "parentRegionId");
            return checked(VERSION + SEP + TAG_STATION_PAGE + SEP + encodeId(parentRegionId) + SEP + page);
        }
        return checked(VERSION + SEP + TAG_REGION_PAGE + SEP + page);
    }

    /**
     * Encodes any token. Invalid tokens cannot be encoded.
     */
    public String encode(NavigationToken token) {
        switch (token.type()) {
            case PAGE:
                return encode(token.listKind(), token.regionId(), token.page());
            case PICK_REGION:
                return encodePickRegion(token.regionId());
            case PICK_STATION:
                return encodePickStation(token.regionId(), token.stationId());
            case BACK:
                return VERSION + SEP + TAG_BACK;
            case ADMIN_REPORT:
                return VERSION + SEP + TAG_ADMIN_REPORT;
            case NOOP:
                return VERSION + SEP + TAG_NOOP;
            default:
                throw new IllegalArgumentException("Cannot encode token of type " + token.type());
        }
    }

    public String encodePickRegion(String regionId) {
        requireId(regionId, "regionId");
        return checked(VERSION + SEP + TAG_PICK_REGION + SEP + encodeId(regionId));
    }

    public String encodePickStation(String regionId, String stationId) {
        requireId(regionId, "regionId");
        requireId(stationId, "stationId");
        return checked(VERSION + SEP + TAG_PICK_STATION + SEP + encodeId(regionId) + SEP + encodeId(stationId));
    }

    public String encodeBack() {
        return encode(NavigationToken.back());
    }

    public String encodeAdminReport() {
        return encode(NavigationToken.adminReport());
    }

    public String encodeNoop() {
        return encode(NavigationToken.noop());
    }

    // -----------------------------------------------------------------------
    // Decoding
    // -----------------------------------------------------------------------

    /**
     * Decodes a payload. Never throws: anything that is not a well-formed payload of a
     * known version decodes to an {@link com.synoptic.stationbot.model.TokenType#INVALID} token.
     */
    public NavigationToken decode(String payload) {
        if (payload == null || payload.isBlank()) {
            return NavigationToken.invalid("empty payload");
        }
        String[] parts = payload.split(SEP, -1);
        if (parts.length < 2) {
            return NavigationToken.invalid("missing tag");
        }
        if (!VERSION.equals(parts[0])) {
            return NavigationToken.invalid("unsupported version '" + parts[0] + "'");
        }

        try {
            switch (parts[1]) {
                case TAG_REGION_PAGE:
                    expectParts(parts, 3);
                    return NavigationToken.regionPage(parsePage(parts[2]));
                case TAG_STATION_PAGE:
                    expectParts(parts, 4);
                    return NavigationToken.stationPage(decodeId(parts[2]), parsePage(parts[3]));
                case TAG_PICK_REGION:
                    expectParts(parts, 3);
                    return NavigationToken.pickRegion(decodeId(parts[2]));
                case TAG_PICK_STATION:
                    expectParts(parts, 4);
                    return NavigationToken.pickStation(decodeId(parts[2]), decodeId(parts[3]));
                case TAG_BACK:
                    expectParts(parts, 2);
                    return NavigationToken.back();
                case TAG_ADMIN_REPORT:
                    expectParts(parts, 2);
                    return NavigationToken.adminReport();
                case TAG_NOOP:
                    expectParts(parts, 2);
                    return NavigationToken.noop();
                default:
                    return NavigationToken.invalid("unknown tag '" + parts[1] + "'");
            }
        } catch (IllegalArgumentException e) {
            return NavigationToken.invalid(e.getMessage());
        }
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private static void expectParts(String[] parts, int expected) {
        if (parts.length != expected) {
            throw new IllegalArgumentException("expected " + expected + " components, got " + parts.length);
        }
    }

    private static int parsePage(String value) {
        if (!PAGE_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("malformed page '" + value + "'");
        }
        // NumberFormatException is an IllegalArgumentException: pages past Integer.MAX_VALUE are invalid
        return Integer.parseInt(value);
    }

    static String encodeId(String id) {
        StringBuilder out = new StringBuilder(id.length() + 4);
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (c == '%') {
                out.append("%25");
            } else if (c == ':') {
                out.append("%3A");
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    static String decodeId(String encoded) {
        StringBuilder out = new StringBuilder(encoded.length());
        int i = 0;
        while (i < encoded.length()) {
            char c = encoded.charAt(i);
            if (c != '%') {
                out.append(c);
                i++;
                continue;
            }
            if (i + 3 > encoded.length()) {
                throw new IllegalArgumentException("truncated escape in '" + encoded + "'");
            }
            String escape = encoded.substring(i, i + 3);
            if ("%25".equals(escape)) {
                out.append('%');
            } else if ("%3A".equalsIgnoreCase(escape)) {
                out.append(':');
            } else {
                throw new IllegalArgumentException("unknown escape '" + escape + "'");
            }
            i += 3;
        }
        String id = out.toString();
        if (id.isBlank()) {
            throw new IllegalArgumentException("empty identifier");
        }
        return id;
    }

    private static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static String checked(String payload) {
        int bytes = payload.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("payload of " + bytes + " bytes exceeds " + MAX_PAYLOAD_BYTES);
        }
        return payload;
    }
}
