package com.work.anchor.core.exception;

/**
 * 连接阶段的配置错误：节点不可达、未配置 RPC 地址或签名私钥等。
 */
public class ConfigurationException extends AnchorException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
