package org.Aayush.schedule.directive;

import org.Aayush.schedule.time.TimeMapException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Month Name Table Tests")
class MonthNamesTest {

    @ParameterizedTest
    @CsvSource({
            "JAN, 1", "FEB, 2", "MAR, 3", "APR, 4",
            "MAY, 5", "MAI, 5", "JUN, 6", "JUL, 7", "JLY, 7",
            "AUG, 8", "SEP, 9", "OCT, 10", "OKT, 10",
            "NOV, 11", "DEC, 12", "DES, 12"
    })
    void testKnownNames(String name, int expectedMonth) {
        assertEquals(expectedMonth, MonthNames.monthIndex(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"jan", "Jan", "JANUARY", "JUNE", "SEPT", "", " JAN"})
    void testUnknownNamesRejected(String name) {
        TimeMapException ex = assertThrows(TimeMapException.class, () -> MonthNames.monthIndex(name));
        assertEquals(TimeMapException.REASON_UNKNOWN_MONTH_NAME, ex.reasonCode());
    }

    @Test
    void testNullNameRejected() {
        TimeMapException ex = assertThrows(TimeMapException.class, () -> MonthNames.monthIndex(null));
        assertEquals(TimeMapException.REASON_UNKNOWN_MONTH_NAME, ex.reasonCode());
    }

    @Test
    void testTableIsImmutable() {
        assertEquals(16, MonthNames.monthIndices().size());
        assertThrows(UnsupportedOperationException.class, () -> MonthNames.monthIndices().put("MAJ", 5));
    }
}
