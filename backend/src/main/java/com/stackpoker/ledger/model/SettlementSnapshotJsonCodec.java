package com.stackpoker.ledger.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Encodes the financial facts of a stake at the moment of a status transition so a
 * reopened or re-settled stake can be compared against what was agreed before.
 */
public final class SettlementSnapshotJsonCodec {

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();

    private static final String FIELD_STATUS = "status";
    private static final String FIELD_PERCENTAGE = "stake_percentage";
    private static final String FIELD_MARKUP = "markup";
    private static final String FIELD_BUY_IN = "session_buy_in";
    private static final String FIELD_CASHOUT = "session_cashout";
    private static final String FIELD_SETTLEMENT = "settlement_amount";

    private static final Set<String> REQUIRED_FIELDS = Set.of(
            FIELD_STATUS,
            FIELD_PERCENTAGE,
            FIELD_MARKUP,
            FIELD_BUY_IN,
            FIELD_CASHOUT,
            FIELD_SETTLEMENT
    );

    private SettlementSnapshotJsonCodec() {
    }

    public static String toJson(StakeContract stake) {
        if (stake == null) {
            throw new IllegalArgumentException("Stake is required");
        }
        ObjectNode node = OBJECT_MAPPER.createObjectNode();
        node.put(FIELD_STATUS, stake.getStatus().name());
        node.put(FIELD_PERCENTAGE, stake.getStakePercentage().toPlainString());
        node.put(FIELD_MARKUP, stake.getMarkup().toPlainString());
        node.put(FIELD_BUY_IN, stake.getSessionBuyIn().toPlainString());
        node.put(FIELD_CASHOUT, stake.getSessionCashout().toPlainString());
        node.put(FIELD_SETTLEMENT, stake.getSettlementAmount().toPlainString());
        try {
            return OBJECT_MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode settlement snapshot", ex);
        }
    }

    public static SettlementSnapshot fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Settlement snapshot JSON is required");
        }
        JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Settlement snapshot is not valid JSON", ex);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Settlement snapshot JSON must be an object");
        }
        for (String field : REQUIRED_FIELDS) {
            if (!node.hasNonNull(field)) {
                throw new IllegalArgumentException("Settlement snapshot is missing field: " + field);
            }
        }
        return new SettlementSnapshot(
                StakeStatus.valueOf(node.get(FIELD_STATUS).asText()),
                decimalField(node, FIELD_PERCENTAGE),
                decimalField(node, FIELD_MARKUP),
                decimalField(node, FIELD_BUY_IN),
                decimalField(node, FIELD_CASHOUT),
                decimalField(node, FIELD_SETTLEMENT)
        );
    }

    private static BigDecimal decimalField(JsonNode node, String field) {
        try {
            return new BigDecimal(node.get(field).asText());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Settlement snapshot field is not a decimal: " + field, ex);
        }
    }

    public record SettlementSnapshot(
            StakeStatus status,
            BigDecimal stakePercentage,
            BigDecimal markup,
            BigDecimal sessionBuyIn,
            BigDecimal sessionCashout,
            BigDecimal settlementAmount
    ) {
    }
}
