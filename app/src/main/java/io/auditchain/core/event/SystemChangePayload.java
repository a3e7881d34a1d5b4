package io.auditchain.core.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SystemChangePayload(
        @JsonProperty("component") String component,
        @JsonProperty("change_type") String changeType,
        @JsonProperty("description") String description,
        @JsonProperty("actor") String actor
) implements EventPayload {

    public SystemChangePayload {
        component = Fields.requireText(component, "component");
        changeType = Fields.requireText(changeType, "change_type");
        description = Fields.optionalText(description);
        actor = Fields.optionalText(actor);
    }

    @Override
    public EventKind kind() {
        return EventKind.SYSTEM_CHANGE;
    }
}
