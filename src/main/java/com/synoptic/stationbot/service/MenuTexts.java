package com.synoptic.stationbot.service;

import com.synoptic.stationbot.model.DailyReport;
import com.synoptic.stationbot.model.DownloadEvent;
import com.synoptic.stationbot.model.StationExport;
import com.synoptic.stationbot.model.UserDownloadStats;

/**
 * User-facing strings. English placeholders; nothing here is parsed back.
 */
public final class MenuTexts {

    public static final String WELCOME = "Welcome! Pick a region to browse its stations.";
    public static final String CHOOSE_REGION = "Choose a region:";
    public static final String NO_REGIONS = "No regions are available right now. Please try again later.";
    public static final String MENU_EXPIRED = "That menu is no longer valid. Here is the region list again.";
    public static final String QUOTA_DENIED = "Download limit reached. Please try again later.";
    public static final String EXPORT_UNAVAILABLE = "Data for this station is currently unavailable.";
    public static final String EXPORT_FAILED = "The file could not be delivered. Your quota was not used.";
    public static final String INTERNAL_ERROR = "Something went wrong. Please try again.";
    public static final String NOT_AUTHORIZED = "You are not authorized to use this command.";
    public static final String UNKNOWN_COMMAND = "Unknown command. Send /help for usage.";
    public static final String USER_USAGE = "Usage: /user <id>";
    public static final String REFERENCE_DOCUMENT_MISSING = "The data guide is not available on the server right now.";

    public static final String BUTTON_PREV = "« Prev";
    public static final String BUTTON_NEXT = "Next »";
    public static final String BUTTON_BACK = "« Back";
    public static final String BUTTON_ADMIN_REPORT = "Admin Report";

    private MenuTexts() {
    }

    public static String help(int monthlyCap) {
        StringBuilder sb = new StringBuilder()
                .append("Send /start to open the region list, pick a region, then pick a station ")
                .append("to receive its data as a CSV file.\n\n")
                .append("Limit: one download per day");
        if (monthlyCap > 0) {
            sb.append(" and ").append(monthlyCap).append(" per month");
        }
        return sb.append('.').toString();
    }

    public static String chooseStation(String regionName) {
        return "Stations in " + regionName + ":";
    }

    public static String noStations(String regionName) {
        return "No stations found in " + regionName + ".";
    }

    public static String pageIndicator(int page, int pageCount) {
        return "Page " + (page + 1) + "/" + pageCount;
    }

    public static String stationDetail(StationExport export) {
        return "Selected station: " + export.stationName() + " (" + export.stationId() + ")\n"
                + "Data available from " + export.intervalStart() + " to " + export.intervalEnd();
    }

    public static String exportCaption(StationExport export) {
        return export.stationName() + " (" + export.stationId() + ")\n"
                + export.intervalStart() + " to " + export.intervalEnd()
                + ", " + export.rowCount() + " rows";
    }

    public static String adminNotice(String displayName, long userId, StationExport export) {
        return "Download: " + displayName + " (" + userId + ") took station "
                + export.stationName() + " (" + export.stationId() + ")";
    }

    public static String dailyReport(DailyReport report) {
        StringBuilder sb = new StringBuilder()
                .append("Downloads on ").append(report.date())
                .append(": ").append(report.totalDownloads());
        for (DownloadEvent e : report.downloads()) {
            sb.append('\n')
                    .append("- ").append(e.getDisplayName() == null ? "?" : e.getDisplayName())
                    .append(" (").append(e.getUserId()).append(") ")
                    .append(e.getStationId());
        }
        return sb.toString();
    }

    public static String userStats(UserDownloadStats stats) {
        return "User " + stats.userId() + ": " + stats.totalDownloads() + " downloads\n"
                + "Stations: " + (stats.stations().isEmpty() ? "none" : String.join(", ", stats.stations()));
    }

    public static String usersCount(long count) {
        return "Distinct users with downloads: " + count;
    }
}
