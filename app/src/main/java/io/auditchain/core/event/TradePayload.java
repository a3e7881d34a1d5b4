package io.auditchain.core.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/** An executed trade as reported by the broker integration. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TradePayload(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("side") TradeSide side,
        @JsonProperty("quantity") BigDecimal quantity,
        @JsonProperty("price") BigDecimal price,
        @JsonProperty("trade_id") String tradeId,
        @JsonProperty("order_id") String orderId,
        @JsonProperty("broker") String broker,
        @JsonProperty("strategy") String strategy
) implements EventPayload {

    public TradePayload {
        symbol = Fields.requireText(symbol, "symbol");
        Fields.requireValue(side, "side");
        Fields.requirePositive(quantity, "quantity");
        Fields.requirePositive(price, "price");
        tradeId = Fields.optionalText(tradeId);
        orderId = Fields.optionalText(orderId);
        broker = Fields.optionalText(broker);
        strategy = Fields.optionalText(strategy);
    }

    public static TradePayload of(String symbol, TradeSide side, BigDecimal quantity, BigDecimal price) {
        return new TradePayload(symbol, side, quantity, price, null, null, null, null);
    }

    @Override
    public EventKind kind() {
        return EventKind.TRADE;
    }
}
