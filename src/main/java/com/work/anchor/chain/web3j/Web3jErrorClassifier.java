package com.work.anchor.chain.web3j;

import com.work.anchor.core.exception.AnchorException;
import com.work.anchor.core.exception.ConfirmationTimeoutException;
import com.work.anchor.core.exception.InsufficientFundsException;
import com.work.anchor.core.exception.NonceConflictException;
import com.work.anchor.core.exception.UnhandledTransportException;
import org.web3j.protocol.core.Response;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Signer 边界上的错误归类：把 JSON-RPC 错误与 IO 异常映射为引擎认识的封闭异常集合。
 *
 * 引擎内部只按异常类型处理，节点文案的匹配只在这里出现。
 */
public final class Web3jErrorClassifier {

    private static final List<String> INSUFFICIENT_FUNDS_PATTERNS = Arrays.asList(
            "insufficient funds");

    private static final List<String> NONCE_PATTERNS = Arrays.asList(
            "nonce too low",
            "nonce has already been used",
            "correct nonce");

    private Web3jErrorClassifier() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static AnchorException classify(String operation, Response.Error error) {
        if (error == null) {
            return new UnhandledTransportException(operation + " failed without error details");
        }
        return classify(operation, error.getCode(), error.getMessage(), null);
    }

    public static AnchorException classify(String operation, IOException e) {
        if (e instanceof InterruptedIOException) {
            // SocketTimeoutException 也是 InterruptedIOException
            return new ConfirmationTimeoutException(operation + " timed out: " + e.getMessage(), e);
        }
        return classify(operation, 0, e.getMessage(), e);
    }

    static AnchorException classify(String operation, int code, String message, Throwable cause) {
        String detail = operation + " failed [code=" + code + "]: " + message;
        String normalized = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (matchesAny(normalized, INSUFFICIENT_FUNDS_PATTERNS)) {
            return new InsufficientFundsException(detail, cause);
        }
        if (matchesAny(normalized, NONCE_PATTERNS)) {
            return new NonceConflictException(detail, cause);
        }
        return new UnhandledTransportException(detail, cause);
    }

    private static boolean matchesAny(String message, List<String> patterns) {
        for (String p : patterns) {
            if (message.contains(p)) {
                return true;
            }
        }
        return false;
    }
}
