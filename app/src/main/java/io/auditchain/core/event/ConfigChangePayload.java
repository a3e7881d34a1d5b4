package io.auditchain.core.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A single configuration key changing value. Values are recorded as their string form. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfigChangePayload(
        @JsonProperty("component") String component,
        @JsonProperty("key") String key,
        @JsonProperty("old_value") String oldValue,
        @JsonProperty("new_value") String newValue,
        @JsonProperty("changed_by") String changedBy
) implements EventPayload {

    public ConfigChangePayload {
        component = Fields.requireText(component, "component");
        key = Fields.requireText(key, "key");
        changedBy = Fields.optionalText(changedBy);
    }

    @Override
    public EventKind kind() {
        return EventKind.CONFIG_CHANGE;
    }
}
