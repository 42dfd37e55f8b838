package com.work.anchor.core.support;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    /**
     * 0x 开头的 20 字节十六进制地址。
     */
    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    /**
     * 校验Duration不能为负（允许为0）
     */
    public static Duration requireNonNegative(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative()) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return duration;
    }

    /**
     * 校验long值必须大于0
     */
    public static long requirePositive(long value, String paramName) {
        if (value <= 0) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return value;
    }

    /**
     * 校验 EVM 地址格式：0x + 40 位十六进制。
     */
    public static String requireValidAddress(String address, String paramName) {
        requireNonEmpty(address, paramName);
        if (!ADDRESS_PATTERN.matcher(address).matches()) {
            throw new IllegalArgumentException(paramName + " 非法，必须为 0x 开头的 40 位十六进制地址");
        }
        return address;
    }
}
