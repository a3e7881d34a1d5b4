package io.auditchain.core.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.auditchain.core.error.InvalidEventException;

import java.math.BigDecimal;

/** Placement, cancellation, fill or rejection of an order. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderPayload(
        @JsonProperty("order_id") String orderId,
        @JsonProperty("symbol") String symbol,
        @JsonProperty("side") TradeSide side,
        @JsonProperty("order_type") OrderType orderType,
        @JsonProperty("action") OrderAction action,
        @JsonProperty("quantity") BigDecimal quantity,
        @JsonProperty("limit_price") BigDecimal limitPrice,
        @JsonProperty("stop_price") BigDecimal stopPrice,
        @JsonProperty("broker") String broker
) implements EventPayload {

    public OrderPayload {
        orderId = Fields.requireText(orderId, "order_id");
        symbol = Fields.requireText(symbol, "symbol");
        Fields.requireValue(side, "side");
        Fields.requireValue(orderType, "order_type");
        Fields.requireValue(action, "action");
        Fields.requirePositive(quantity, "quantity");
        Fields.optionalPositive(limitPrice, "limit_price");
        Fields.optionalPositive(stopPrice, "stop_price");
        if (orderType.needsLimitPrice() && limitPrice == null) {
            throw new InvalidEventException("limit_price", "is required for " + orderType + " orders");
        }
        broker = Fields.optionalText(broker);
    }

    @Override
    public EventKind kind() {
        return EventKind.ORDER;
    }
}
