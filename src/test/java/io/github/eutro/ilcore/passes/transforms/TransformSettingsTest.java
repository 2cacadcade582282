package io.github.eutro.ilcore.passes.transforms;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TransformSettingsTest {
    @Test
    void testDefaults() {
        TransformSettings settings = TransformSettings.DEFAULT;
        assertTrue(settings.isNullCoalescing());
        assertEquals(System.getenv(TransformSettings.CHECK_INVARIANTS_ENV) != null, settings.isCheckInvariants());
        assertEquals(100, settings.getMaxIterations());
        assertEquals(Integer.MAX_VALUE, settings.getStepLimit());
        assertFalse(settings.isRecordSteps());
    }

    @Test
    void testBuilder() {
        TransformSettings settings = TransformSettings.builder()
                .setNullCoalescing(false)
                .setCheckInvariants(true)
                .setMaxIterations(3)
                .setStepLimit(10)
                .setRecordSteps(true)
                .build();
        assertFalse(settings.isNullCoalescing());
        assertTrue(settings.isCheckInvariants());
        assertEquals(3, settings.getMaxIterations());
        assertEquals(10, settings.getStepLimit());
        assertTrue(settings.isRecordSteps());
        assertEquals(settings.toString(), settings.toBuilder().build().toString());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> TransformSettings.builder().setMaxIterations(0));
        assertThrows(IllegalArgumentException.class, () -> TransformSettings.builder().setStepLimit(-1));
    }
}
