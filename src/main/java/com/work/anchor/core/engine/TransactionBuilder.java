package com.work.anchor.core.engine;

import com.work.anchor.core.config.AnchorConfig;
import com.work.anchor.core.config.AnchorMode;
import com.work.anchor.core.model.AnchorPayload;
import com.work.anchor.core.model.TransactionRequest;
import com.work.anchor.core.signer.Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

/**
 * 把 payload 与账户当前 nonce 组装成未签名的交易请求。
 *
 * 除了读取一次 nonce 外没有其它副作用；nonce 之后在整个逻辑提交内保持不变。
 */
public class TransactionBuilder {

    private static final Logger log = LoggerFactory.getLogger(TransactionBuilder.class);

    static final String ANCHOR_FUNCTION = "anchorDagCbor";

    /**
     * CID 头部：version + codec + hash function + digest length。
     */
    static final int CID_HEADER_LENGTH = 4;

    private static final int DIGEST_LENGTH = 32;

    private final Signer signer;
    private final AnchorConfig config;

    public TransactionBuilder(Signer signer, AnchorConfig config) {
        this.signer = signer;
        this.config = config;
    }

    public TransactionRequest build(AnchorPayload payload) {
        log.debug("Preparing ethereum transaction");
        String sender = signer.getAddress();
        BigInteger nonce = signer.getNonce(sender);

        if (config.getMode() == AnchorMode.RAW_DATA) {
            String data = encodeRawData(payload);
            log.debug("Hex encoded root CID {}", data);
            return new TransactionRequest(sender, data, nonce, sender);
        }
        return new TransactionRequest(config.getContractAddress(), encodeContractCall(payload), nonce, sender);
    }

    /**
     * base16 multibase 文本（'f' 前缀），长度为奇数时左补一个 0。
     */
    static String encodeRawData(AnchorPayload payload) {
        String hex = "f" + Numeric.toHexStringNoPrefix(payload.getBytes());
        return "0x" + (hex.length() % 2 == 0 ? hex : "0" + hex);
    }

    static String encodeContractCall(AnchorPayload payload) {
        byte[] bytes = payload.getBytes();
        if (bytes.length != CID_HEADER_LENGTH + DIGEST_LENGTH) {
            throw new IllegalArgumentException("payload 长度必须为 " + (CID_HEADER_LENGTH + DIGEST_LENGTH)
                    + " 字节（CID 头部 + 32 字节摘要），实际为 " + bytes.length);
        }
        byte[] digest = Arrays.copyOfRange(bytes, CID_HEADER_LENGTH, bytes.length);
        Function function = new Function(ANCHOR_FUNCTION,
                Collections.<Type>singletonList(new Bytes32(digest)),
                Collections.<TypeReference<?>>emptyList());
        return FunctionEncoder.encode(function);
    }
}
