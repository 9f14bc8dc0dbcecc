package ou.capstone.surf.print;

import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import ou.capstone.surf.forecast.DayForecast;
import ou.capstone.surf.forecast.WeekForecast;

/**
 * Console table of ranked spots. Rows are printed in the order given, which
 * is the ranking order.
 *
 * Provides both {@link #print(List)} for CLI stdout and {@link #render(List)}
 * for tests.
 */
public class SpotReportPrinter {

    protected static final int RANK_COL_WIDTH    = 3;
    protected static final int NAME_COL_WIDTH    = 22;
    protected static final int SCORE_COL_WIDTH   = 5;
    protected static final int RATING_COL_WIDTH  = 9;
    protected static final int WINDOW_COL_WIDTH  = 21;
    protected static final int DETAIL_COL_WIDTH  = 72;

    private static final int DETAIL_INDENT = RANK_COL_WIDTH + 2;

    public void print(final List<SpotView> spots) {
        System.out.println(render(spots));
    }

    /**
     * @param spots rows in ranking order; null or empty gives an empty-state line
     */
    public String render(final List<SpotView> spots) {
        if (spots == null || spots.isEmpty()) {
            return "No spots to display.";
        }

        final StringBuilder sb = new StringBuilder();
        sb.append(buildHeader()).append('\n');
        sb.append(buildSeparator()).append('\n');
        for (final SpotView spot : spots) {
            sb.append(formatRow(spot)).append('\n');
        }
        return sb.toString();
    }

    /** One line per day, best day marked with '*', then the reason. */
    public String renderWeek(final WeekForecast week) {
        if (week == null || week.days().isEmpty()) {
            return "No forecast to display.";
        }
        final StringBuilder sb = new StringBuilder();
        for (final DayForecast day : week.days()) {
            final String marker = (day == week.bestDay()) ? "*" : " ";
            final String window = day.window()
                    .map(w -> w.startLabel() + " - " + w.endLabel())
                    .orElse("-");
            sb.append(String.format(Locale.ROOT, "%s %s %s  %s  %s  %s  %s",
                    marker,
                    pad(day.dayName(), 3),
                    pad(day.dateLabel(), 6),
                    StringUtils.leftPad(String.valueOf(day.score()), 3),
                    pad(window, WINDOW_COL_WIDTH),
                    pad(day.moon().phase().displayName(), 15),
                    day.analysis())).append('\n');
        }
        sb.append("Best: ").append(week.bestDayReason());
        return sb.toString();
    }

    private String buildHeader() {
        return String.format(Locale.ROOT, "%s  %s  %s  %s  %s  %s",
                pad("#", RANK_COL_WIDTH),
                pad("Spot", NAME_COL_WIDTH),
                pad("Score", SCORE_COL_WIDTH),
                pad("Rating", RATING_COL_WIDTH),
                pad("Best window", WINDOW_COL_WIDTH),
                "Dawn patrol");
    }

    private String buildSeparator() {
        return "-".repeat(RANK_COL_WIDTH + 2
                + NAME_COL_WIDTH + 2
                + SCORE_COL_WIDTH + 2
                + RATING_COL_WIDTH + 2
                + WINDOW_COL_WIDTH + 2
                + DETAIL_COL_WIDTH / 2);
    }

    protected final String formatRow(final SpotView s) {
        final StringBuilder row = new StringBuilder(String.format(Locale.ROOT, "%s  %s  %s  %s  %s  %s",
                pad(String.valueOf(s.rank()), RANK_COL_WIDTH),
                pad(clamp(s.name(), NAME_COL_WIDTH), NAME_COL_WIDTH),
                StringUtils.leftPad(String.valueOf(s.score()), SCORE_COL_WIDTH),
                pad(s.rating(), RATING_COL_WIDTH),
                pad(clamp(s.bestWindow(), WINDOW_COL_WIDTH), WINDOW_COL_WIDTH),
                StringUtils.defaultIfBlank(s.dawnPatrol(), "-")));

        final String indent = " ".repeat(DETAIL_INDENT);
        if (StringUtils.isNotBlank(s.breakdown())) {
            for (final String line : wrapText(s.breakdown()).split("\n")) {
                row.append('\n').append(indent).append(line);
            }
        }
        if (StringUtils.isNotBlank(s.percentile())) {
            row.append('\n').append(indent).append(s.percentile());
        }
        return row.toString();
    }

    // Helper methods

    protected static String pad(final String value, final int width) {
        final String v = (value == null) ? "-" : value;
        return StringUtils.rightPad(v, width);
    }

    protected static String clamp(final String text, final int maxLength) {
        if (text == null) {
            return "-";
        }
        final String normalized = text.trim().replaceAll("\\s+", " ");
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return StringUtils.abbreviate(normalized, maxLength);
    }

    /**
     * Wraps text at spaces to the detail column width. Words longer than the
     * column are left whole on their own line.
     */
    protected static String wrapText(final String text) {
        if (text == null || text.length() <= DETAIL_COL_WIDTH) {
            return text;
        }
        final StringBuilder result = new StringBuilder();
        StringBuilder currentLine = new StringBuilder();
        for (final String word : text.split(" ")) {
            final int potentialLength = currentLine.length() + (currentLine.length() > 0 ? 1 : 0) + word.length();
            if (potentialLength > DETAIL_COL_WIDTH && currentLine.length() > 0) {
                if (result.length() > 0) {
                    result.append('\n');
                }
                result.append(currentLine);
                currentLine = new StringBuilder();
            }
            if (currentLine.length() > 0) {
                currentLine.append(' ');
            }
            currentLine.append(word);
        }
        if (currentLine.length() > 0) {
            if (result.length() > 0) {
                result.append('\n');
            }
            result.append(currentLine);
        }
        return result.toString();
    }
}
