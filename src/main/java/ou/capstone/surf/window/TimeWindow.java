package ou.capstone.surf.window;

/**
 * A recommended surf session, in whole hours of the local day.
 *
 * @param startHour first hour of the session (inclusive)
 * @param endHour   hour the session ends (exclusive)
 */
public record TimeWindow(int startHour, int endHour, String reason) {

    public TimeWindow {
        if (startHour < 0 || endHour > 24 || endHour <= startHour) {
            throw new IllegalArgumentException("Invalid window " + startHour + "-" + endHour);
        }
        reason = (reason == null) ? "" : reason;
    }

    public String startLabel() {
        return formatHour(startHour);
    }

    public String endLabel() {
        return formatHour(endHour);
    }

    public int lengthHours() {
        return endHour - startHour;
    }

    /** 6 -> "6:00 AM", 12 -> "12:00 PM", 0 and 24 -> "12:00 AM". */
    public static String formatHour(final int hour) {
        if (hour == 0 || hour == 24) return "12:00 AM";
        if (hour == 12) return "12:00 PM";
        if (hour < 12) return hour + ":00 AM";
        return (hour - 12) + ":00 PM";
    }

    @Override
    public String toString() {
        return startLabel() + " - " + endLabel() + " (" + reason + ")";
    }
}
