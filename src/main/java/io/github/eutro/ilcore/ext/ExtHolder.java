package io.github.eutro.ilcore.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * An implementation of {@link ExtContainer} using a small sorted array.
 * <p>
 * Most holders carry no exts at all, and the rest carry one or two,
 * so nothing is allocated until the first ext is attached.
 */
public class ExtHolder implements ExtContainer {
    private static final Ext<?>[] NO_KEYS = new Ext<?>[0];
    private static final Object[] NO_VALUES = new Object[0];

    private Ext<?>[] keys = NO_KEYS;
    private Object[] values = NO_VALUES;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        int i = Arrays.binarySearch(keys, ext);
        if (i >= 0) {
            values[i] = value;
            return;
        }
        int at = -(i + 1);
        Ext<?>[] newKeys = new Ext<?>[keys.length + 1];
        Object[] newValues = new Object[values.length + 1];
        System.arraycopy(keys, 0, newKeys, 0, at);
        System.arraycopy(values, 0, newValues, 0, at);
        newKeys[at] = ext;
        newValues[at] = value;
        System.arraycopy(keys, at, newKeys, at + 1, keys.length - at);
        System.arraycopy(values, at, newValues, at + 1, values.length - at);
        keys = newKeys;
        values = newValues;
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        int i = Arrays.binarySearch(keys, ext);
        if (i < 0) return;
        if (keys.length == 1) {
            keys = NO_KEYS;
            values = NO_VALUES;
            return;
        }
        Ext<?>[] newKeys = new Ext<?>[keys.length - 1];
        Object[] newValues = new Object[values.length - 1];
        System.arraycopy(keys, 0, newKeys, 0, i);
        System.arraycopy(values, 0, newValues, 0, i);
        System.arraycopy(keys, i + 1, newKeys, i, keys.length - i - 1);
        System.arraycopy(values, i + 1, newValues, i, values.length - i - 1);
        keys = newKeys;
        values = newValues;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        int i = Arrays.binarySearch(keys, ext);
        return i < 0 ? null : (T) values[i];
    }
}
