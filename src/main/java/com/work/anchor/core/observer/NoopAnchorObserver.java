package com.work.anchor.core.observer;

/**
 * 默认 no-op 实现：保证引擎在不接入任何观测实现时仍可运行。
 */
public class NoopAnchorObserver implements AnchorObserver {
}
