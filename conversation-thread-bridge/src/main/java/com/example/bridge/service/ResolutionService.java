package com.example.bridge.service;

import com.example.bridge.config.BridgeProperties;
import com.example.bridge.domain.ConversationContext;
import com.example.bridge.domain.MappingStrategy;
import com.example.bridge.domain.ThreadResolution;
import com.example.bridge.dto.InboundActivity;
import com.example.bridge.service.exception.StoreUnavailableException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Entry point for the message handling layer: validates the inbound activity and resolves it with
 * the configured strategy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResolutionService {

    private final ConversationContextValidator validator;
    private final ThreadIdResolver threadIdResolver;
    private final BridgeProperties bridgeProperties;

    public ThreadResolution resolve(InboundActivity activity) {
        return resolve(validator.validate(activity));
    }

    public String resolveThreadId(InboundActivity activity) {
        return resolve(activity).getThreadId();
    }

    /**
     * Resolves an already built context. It must carry all four identity fields, otherwise a
     * {@link com.example.bridge.service.exception.ContextValidationException} is thrown before any
     * strategy runs.
     */
    public ThreadResolution resolve(ConversationContext context) {
        validator.requireComplete(context);
        MappingStrategy strategy = bridgeProperties.getStrategy();
        ThreadResolution resolution;
        try {
            resolution = threadIdResolver.resolve(context, strategy);
        } catch (StoreUnavailableException ex) {
            if (strategy != MappingStrategy.DATABASE || !bridgeProperties.getDatabase().isFallbackToHash()) {
                throw ex;
            }
            log.warn("Mapping store unavailable for tenant {}, falling back to hash strategy: {}",
                    context.getTenantId(), ex.getMessage());
            resolution = threadIdResolver.resolve(context, MappingStrategy.HASH);
        }
        log.debug("Resolved {} conversation for tenant {} to thread {} via {}",
                context.getConversationType(), context.getTenantId(), resolution.getThreadId(),
                resolution.getStrategy());
        return resolution;
    }

    public Optional<ConversationContext> lookupContext(String threadId) {
        if (!StringUtils.hasText(threadId)) {
            return Optional.empty();
        }
        return threadIdResolver.lookupContext(threadId, bridgeProperties.getStrategy());
    }
}
