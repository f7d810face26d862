package com.example.bridge.service.strategy;

import com.example.bridge.config.BridgeProperties;
import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.MappingStrategy;
import com.example.bridge.domain.ThreadResolution;
import com.example.bridge.service.ScopeKeyFactory;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.springframework.stereotype.Component;

/**
 * Derives the thread id from a digest of the scope key. Stateless: the same context always yields
 * the same id on every instance.
 */
@Component
public class HashThreadIdStrategy implements ThreadIdStrategy {

    private final ScopeKeyFactory scopeKeyFactory;
    private final String prefix;
    private final String algorithm;
    private final int length;

    public HashThreadIdStrategy(ScopeKeyFactory scopeKeyFactory, BridgeProperties bridgeProperties) {
        this.scopeKeyFactory = scopeKeyFactory;
        BridgeProperties.Hash hash = bridgeProperties.getHash();
        this.prefix = hash.getPrefix();
        this.algorithm = hash.getAlgorithm();
        this.length = hash.getLength();
        int digestHexLength = newDigest().getDigestLength() * 2;
        if (length > digestHexLength) {
            throw new IllegalStateException("bridge.hash.length " + length + " exceeds the "
                    + digestHexLength + " hex characters produced by " + algorithm);
        }
    }

    @Override
    public MappingStrategy getStrategy() {
        return MappingStrategy.HASH;
    }

    @Override
    public ThreadResolution resolve(ConversationContext context) {
        String scopeKey = scopeKeyFactory.scopeKey(context);
        return ThreadResolution.builder()
                .threadId(threadId(scopeKey))
                .strategy(MappingStrategy.HASH)
                .scopeKey(scopeKey)
                .build();
    }

    String threadId(String scopeKey) {
        byte[] digest = newDigest().digest(scopeKey.getBytes(StandardCharsets.UTF_8));
        return prefix + "-" + HexFormat.of().formatHex(digest).substring(0, length);
    }

    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Digest algorithm not available: " + algorithm, e);
        }
    }
}
