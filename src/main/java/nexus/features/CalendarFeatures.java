package nexus.features;

import java.time.LocalDate;

/** Features that depend only on the date. */
public final class CalendarFeatures {

    private CalendarFeatures() {
    }

    /** 1..366 */
    public static int dayOfYear(LocalDate date) {
        return date.getDayOfYear();
    }

    /** June through September. */
    public static boolean isMonsoon(LocalDate date) {
        int month = date.getMonthValue();
        return month >= 6 && month <= 9;
    }
}
