package io.auditchain.core.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginPayload(
        @JsonProperty("username") String username,
        @JsonProperty("success") Boolean success,
        @JsonProperty("source_ip") String sourceIp,
        @JsonProperty("method") String method
) implements EventPayload {

    public LoginPayload {
        username = Fields.requireText(username, "username");
        Fields.requireValue(success, "success");
        sourceIp = Fields.optionalText(sourceIp);
        method = Fields.optionalText(method);
    }

    @Override
    public EventKind kind() {
        return EventKind.LOGIN;
    }
}
