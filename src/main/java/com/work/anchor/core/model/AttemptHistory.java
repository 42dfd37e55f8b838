package com.work.anchor.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单次逻辑提交内已广播的响应，按广播顺序只追加。
 * 仅属于一次 submit 调用，调用结束后即丢弃，只在 nonce 冲突回扫时读取。
 */
public class AttemptHistory {

    private final List<TransactionResponse> responses = new ArrayList<>();

    public void append(TransactionResponse response) {
        if (response == null) {
            throw new IllegalArgumentException("response 不能为null");
        }
        responses.add(response);
    }

    public boolean isEmpty() {
        return responses.isEmpty();
    }

    public int size() {
        return responses.size();
    }

    /**
     * 最新的在前。
     */
    public List<TransactionResponse> newestFirst() {
        List<TransactionResponse> copy = new ArrayList<>(responses);
        Collections.reverse(copy);
        return copy;
    }
}
