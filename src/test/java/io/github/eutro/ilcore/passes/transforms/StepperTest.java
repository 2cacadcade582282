package io.github.eutro.ilcore.passes.transforms;

import io.github.eutro.ilcore.ext.CommonExts;
import io.github.eutro.ilcore.il.LdNull;
import io.github.eutro.ilcore.il.Nop;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StepperTest {
    @Test
    void testCountsAndTags() {
        Stepper stepper = new Stepper();
        Nop nop = new Nop();
        stepper.step("first", nop);
        stepper.step("second", nop);
        stepper.step("third", null);
        assertEquals(3, stepper.getStepCount());
        assertEquals(1, (int) nop.getExtOrThrow(CommonExts.LAST_STEP));
        assertEquals("second", nop.getExtOrThrow(CommonExts.LAST_STEP_DESCRIPTION));
        assertTrue(stepper.getSteps().isEmpty());
    }

    @Test
    void testLimit() {
        Stepper stepper = new Stepper(2, false);
        stepper.step("a", null);
        stepper.step("b", null);
        StepLimitReachedException e = assertThrows(StepLimitReachedException.class, () -> stepper.step("c", null));
        assertEquals(2, e.getStepLimit());
        assertEquals(2, stepper.getStepCount());
    }

    @Test
    void testRecording() {
        Stepper stepper = new Stepper(Integer.MAX_VALUE, true);
        LdNull near = new LdNull();
        stepper.beginGroup("outer");
        stepper.step("a", near);
        stepper.beginGroup("inner");
        stepper.step("b", null);
        stepper.endGroup();
        stepper.endGroup();
        stepper.step("c", null);

        List<Stepper.Step> steps = stepper.getSteps();
        assertEquals(2, steps.size());
        Stepper.Step outer = steps.get(0);
        assertEquals("outer", outer.getDescription());
        assertEquals(0, outer.getIndex());
        assertEquals(2, outer.getChildren().size());

        Stepper.Step a = outer.getChildren().get(0);
        assertEquals(0, a.getIndex());
        assertSame(near, a.getNear());
        assertEquals("ldnull", a.getNearText());

        Stepper.Step inner = outer.getChildren().get(1);
        assertEquals(1, inner.getIndex());
        assertEquals("1: b", inner.getChildren().get(0).toString());

        assertEquals(2, steps.get(1).getIndex());
        assertTrue(steps.get(1).getChildren().isEmpty());
    }

    @Test
    void testUnbalancedGroups() {
        Stepper recording = new Stepper(Integer.MAX_VALUE, true);
        assertThrows(IllegalStateException.class, recording::endGroup);
        Stepper plain = new Stepper();
        plain.beginGroup("g");
        plain.endGroup();
        assertThrows(IllegalStateException.class, plain::endGroup);
    }

    @Test
    void testFromSettings() {
        Stepper stepper = Stepper.of(TransformSettings.builder().setStepLimit(0).setRecordSteps(true).build());
        assertThrows(StepLimitReachedException.class, () -> stepper.step("a", null));
    }
}
