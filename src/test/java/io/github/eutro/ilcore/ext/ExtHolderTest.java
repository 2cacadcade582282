package io.github.eutro.ilcore.ext;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExtHolderTest {
    private static final List<Ext<String>> EXTS = Arrays.asList(
            Ext.create(String.class, "a"),
            Ext.create(String.class, "b"),
            Ext.create(String.class, "c"),
            Ext.create(String.class, "d")
    );

    @Test
    void testAttachAndRemove() {
        ExtHolder eh = new ExtHolder();
        // out of creation order
        for (int i : new int[]{2, 0, 3, 1}) {
            eh.attachExt(EXTS.get(i), "v" + i);
        }
        for (int i = 0; i < EXTS.size(); i++) {
            assertEquals("v" + i, eh.getExtOrThrow(EXTS.get(i)));
        }

        eh.attachExt(EXTS.get(1), "again");
        assertEquals("again", eh.getNullable(EXTS.get(1)));

        eh.removeExt(EXTS.get(0));
        eh.removeExt(EXTS.get(0));
        assertFalse(eh.getExt(EXTS.get(0)).isPresent());
        assertEquals("v3", eh.getNullable(EXTS.get(3)));

        for (Ext<String> ext : EXTS) {
            eh.removeExt(ext);
        }
        assertNull(eh.getNullable(EXTS.get(2)));
    }

    @Test
    void testGetExtOrThrow() {
        ExtHolder eh = new ExtHolder();
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> eh.getExtOrThrow(CommonExts.LAST_STEP));
        assertEquals("Ext not present: LAST_STEP", e.getMessage());
        assertEquals("v", EXTS.get(0).getIn(withValue(EXTS.get(0), "v")).orElse(null));
    }

    private static ExtHolder withValue(Ext<String> ext, String value) {
        ExtHolder eh = new ExtHolder();
        eh.attachExt(ext, value);
        return eh;
    }
}
