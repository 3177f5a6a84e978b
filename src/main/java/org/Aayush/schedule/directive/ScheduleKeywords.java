package org.Aayush.schedule.directive;

/**
 * Keyword names that drive time-map construction and their classification.
 */
public final class ScheduleKeywords {
    public static final String START = "START";
    public static final String DATES = "DATES";
    public static final String TSTEP = "TSTEP";

    /**
     * Role of a keyword during construction.
     */
    public enum DirectiveKind {
        START,
        ABSOLUTE_DATE,
        RELATIVE_ADVANCE,
        OTHER
    }

    private ScheduleKeywords() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Classifies a keyword name; unknown and {@code null} names are {@link DirectiveKind#OTHER}.
     */
    public static DirectiveKind kindOf(String keyword) {
        if (keyword == null) {
            return DirectiveKind.OTHER;
        }
        switch (keyword) {
            case START:
                return DirectiveKind.START;
            case DATES:
                return DirectiveKind.ABSOLUTE_DATE;
            case TSTEP:
                return DirectiveKind.RELATIVE_ADVANCE;
            default:
                return DirectiveKind.OTHER;
        }
    }
}
