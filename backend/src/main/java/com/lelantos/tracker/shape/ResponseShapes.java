package com.lelantos.tracker.shape;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

import static com.lelantos.tracker.shape.ShapeRule.bareArray;
import static com.lelantos.tracker.shape.ShapeRule.envelope;

/**
 * Known shapes of the list-valued tracker responses, in the order they are tried, plus the field aliases used for
 * wallet identity. Anything that matches no rule reads as an empty list.
 */
public final class ResponseShapes {

    public static final List<ShapeRule> HOLDERS = List.of(envelope("accounts"), envelope("holders"), bareArray());
    public static final List<ShapeRule> TRADES = List.of(bareArray(), envelope("trades"));
    public static final List<ShapeRule> TOP_TRADERS = List.of(bareArray(), envelope("traders"));
    public static final List<ShapeRule> FIRST_BUYERS = List.of(bareArray());

    /** Holder entries name the wallet owner, address or wallet. */
    public static final String[] HOLDER_IDENTITY = {"owner", "address", "wallet"};
    /** Trader entries name the wallet wallet, owner or address. */
    public static final String[] TRADER_IDENTITY = {"wallet", "owner", "address"};

    private ResponseShapes() {
    }

    public static List<JsonNode> extractList(JsonNode root, List<ShapeRule> rules) {
        for (ShapeRule rule : rules) {
            var match = rule.match(root);
            if (match.isPresent()) {
                List<JsonNode> items = new ArrayList<>(match.get().size());
                match.get().forEach(items::add);
                return items;
            }
        }
        return List.of();
    }
}
