package com.work.anchor.core.config;

/**
 * 锚定交易的构造方式，属于静态配置而非逐次决策。
 */
public enum AnchorMode {
    /**
     * 普通交易：to=发送方自身地址，data=payload 的 base16 文本。
     */
    RAW_DATA,

    /**
     * 合约调用：to=锚定合约地址，data=anchorDagCbor(bytes32) 调用数据。
     */
    SMART_CONTRACT
}
