package com.work.anchor.core.model;

import java.util.Objects;

/**
 * 数字形式的链 ID，对外以 CAIP-2 形式（eip155:&lt;n&gt;）表示。
 */
public final class ChainId {

    public static final String NAMESPACE = "eip155";

    private final long value;

    private ChainId(long value) {
        this.value = value;
    }

    public static ChainId of(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("chainId 必须大于0: " + value);
        }
        return new ChainId(value);
    }

    /**
     * CAIP-2 格式化。
     */
    public static String format(long value) {
        return NAMESPACE + ":" + value;
    }

    public long getValue() {
        return value;
    }

    public String toCaip() {
        return format(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChainId)) return false;
        return value == ((ChainId) o).value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return toCaip();
    }
}
