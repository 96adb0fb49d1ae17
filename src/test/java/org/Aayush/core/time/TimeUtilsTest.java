package org.Aayush.core.time;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

import static org.junit.jupiter.api.Assertions.*;

class TimeUtilsTest {

    // ========== Clamp Tests ==========

    @ParameterizedTest
    @CsvSource({
            "0.5, 0.0, 1.0, 0.5",   // inside
            "1.9, 0.0, 1.0, 1.0",   // above upper
            "-3.0, 0.0, 1.0, 0.0",  // below lower
            "1.0, 0.0, 1.0, 1.0",   // on boundary
            "7.0, 3.0, 3.0, 3.0"    // degenerate interval
    })
    void testClamp(double time, double lower, double upper, double expected) {
        assertEquals(expected, TimeUtils.clamp(time, lower, upper));
    }

    // ========== Ordering Tests ==========

    @Test
    void testIsNonDecreasing_AcceptsAscendingAndEqualNeighbours() {
        assertTrue(TimeUtils.isNonDecreasing(new double[]{0.0, 0.5, 0.5, 1.0}));
    }

    @Test
    void testIsNonDecreasing_RejectsDescendingPair() {
        assertFalse(TimeUtils.isNonDecreasing(new double[]{0.0, 2.0, 1.0}));
    }

    @Test
    void testIsNonDecreasing_TrivialInputs() {
        assertTrue(TimeUtils.isNonDecreasing(null));
        assertTrue(TimeUtils.isNonDecreasing(new double[0]));
        assertTrue(TimeUtils.isNonDecreasing(new double[]{42.0}));
    }

    @Test
    void testSortedCopy_DoesNotModifySource() {
        double[] source = {3.0, 1.0, 2.0};
        assertArrayEquals(new double[]{1.0, 2.0, 3.0}, TimeUtils.sortedCopy(source));
        assertArrayEquals(new double[]{3.0, 1.0, 2.0}, source);
    }

    // ========== Finiteness Tests ==========

    @ParameterizedTest
    @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
    void testRequireFinite_RejectsNonFinite(double value) {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> TimeUtils.requireFinite(value, "start"));
        assertTrue(ex.getMessage().contains("start"));
    }

    @Test
    void testRequireFinite_ReturnsValue() {
        assertEquals(-12.5, TimeUtils.requireFinite(-12.5, "end"));
    }

    @Test
    void testAdvances() {
        assertTrue(TimeUtils.advances(0.0, 1.0));
        assertFalse(TimeUtils.advances(3.0, 3.0));
        assertFalse(TimeUtils.advances(4.0, 3.0));
    }

    @Test
    void testUtilityClassCannotBeInstantiated() throws Exception {
        Constructor<TimeUtils> ctor = TimeUtils.class.getDeclaredConstructor();
        ctor.setAccessible(true);
        InvocationTargetException ex = assertThrows(InvocationTargetException.class, ctor::newInstance);
        assertInstanceOf(AssertionError.class, ex.getCause());
    }
}
