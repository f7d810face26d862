package com.example.bridge.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Channel-neutral view of an inbound message as handed over by the channel adapter. Fields are
 * left unvalidated here; {@code ConversationContextValidator} decides what is acceptable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundActivity {

    private String conversationId;

    /**
     * Channel-local user id.
     */
    private String userId;

    /**
     * Directory object id of the user. Preferred over {@link #userId} because it is the same on
     * every device and client.
     */
    private String aadObjectId;

    private String conversationType;
    private String tenantId;
    private String userName;
    private String channelId;
    private String serviceUrl;

    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnySetter
    public void addExtra(String key, Object value) {
        if (extra == null) {
            extra = new LinkedHashMap<>();
        }
        extra.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }
}
