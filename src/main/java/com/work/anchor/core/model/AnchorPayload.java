package com.work.anchor.core.model;

import java.util.Arrays;

/**
 * 待锚定内容标识（root CID）的原始字节，引擎不解析其结构。
 */
public final class AnchorPayload {

    private final byte[] bytes;

    private AnchorPayload(byte[] bytes) {
        this.bytes = bytes;
    }

    public static AnchorPayload of(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("payload 不能为空");
        }
        return new AnchorPayload(bytes.clone());
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnchorPayload)) return false;
        return Arrays.equals(bytes, ((AnchorPayload) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }
}
