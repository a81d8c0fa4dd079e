package com.kekopoly.server.rules;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kekopoly.server.error.StateConflictException;
import com.kekopoly.server.error.ValidationException;
import com.kekopoly.server.model.Game;
import com.kekopoly.server.model.GameAction;
import com.kekopoly.server.model.Player;

/**
 * Minimal ledger-keeping rules. Prices, rents and card effects come in
 * with the action; the board only records ownership, mortgages, builds
 * and what is left in each deck.
 */
public class StandardRuleBook implements RuleBook {

    static final String[] DECKS = {"meme", "redpill", "eegi"};
    static final int MAX_ENGAGEMENTS = 4;

    private final int cardDeckSize;

    public StandardRuleBook(int cardDeckSize) {
        this.cardDeckSize = cardDeckSize;
    }

    @Override
    public void initBoard(Game game) {
        ObjectNode board = game.getBoard();
        board.putObject("properties");
        ObjectNode cards = board.putObject("cardsRemaining");
        for (String deck : DECKS) cards.put(deck, cardDeckSize);
    }

    @Override
    public ActionOutcome apply(Game game, Player actor, GameAction action) {
        switch (action.type()) {
            case BUY_PROPERTY: return buy(game, actor, action);
            case PAY_RENT: return payRent(game, actor, action);
            case MORTGAGE_PROPERTY: return mortgage(game, actor, action);
            case UNMORTGAGE_PROPERTY: return unmortgage(game, actor, action);
            case BUILD_ENGAGEMENT: return buildEngagement(game, actor, action);
            case BUILD_CHECKMARK: return buildCheckmark(game, actor, action);
            case DRAW_CARD: return drawCard(game, action);
            case USE_CARD: return ActionOutcome.of(detail("cardId", required(action, "cardId")));
            case TRADE: return trade(game, actor, action);
            case SPECIAL: return special(action);
            default:
                throw new ValidationException(action.type() + " is not a rule book action");
        }
    }

    private ActionOutcome buy(Game game, Player actor, GameAction action) {
        String propertyId = required(action, "propertyId");
        long price = amount(action, "price");
        ObjectNode props = properties(game);
        JsonNode existing = props.get(propertyId);
        if (existing != null && existing.hasNonNull("owner")) {
            throw new StateConflictException("Property " + propertyId + " is already owned");
        }
        if (actor.getBalance() < price) {
            throw new StateConflictException("Insufficient funds to buy " + propertyId);
        }
        actor.setBalance(actor.getBalance() - price);
        actor.getProperties().add(propertyId);
        ObjectNode state = props.putObject(propertyId);
        state.put("owner", actor.getId());
        state.put("mortgaged", false);
        state.put("engagements", 0);
        state.put("checkmark", false);
        Map<String, Object> d = detail("propertyId", propertyId);
        d.put("price", price);
        return ActionOutcome.of(d);
    }

    private ActionOutcome payRent(Game game, Player actor, GameAction action) {
        String ownerId = required(action, "ownerId");
        long amount = amount(action, "amount");
        Player owner = game.player(ownerId);
        if (owner == null || owner == actor) {
            throw new ValidationException("Rent owner " + ownerId + " is not another player in this game");
        }
        actor.debit(amount);
        owner.credit(amount);
        Map<String, Object> d = detail("ownerId", ownerId);
        d.put("amount", amount);
        return ActionOutcome.of(d);
    }

    private ActionOutcome mortgage(Game game, Player actor, GameAction action) {
        String propertyId = required(action, "propertyId");
        long value = amount(action, "value");
        ObjectNode state = owned(game, actor, propertyId);
        if (state.path("mortgaged").asBoolean()) {
            throw new StateConflictException("Property " + propertyId + " is already mortgaged");
        }
        state.put("mortgaged", true);
        actor.setBalance(actor.getBalance() + value);
        Map<String, Object> d = detail("propertyId", propertyId);
        d.put("value", value);
        return ActionOutcome.of(d);
    }

    private ActionOutcome unmortgage(Game game, Player actor, GameAction action) {
        String propertyId = required(action, "propertyId");
        long value = amount(action, "value");
        long cost = value + value / 10;
        ObjectNode state = owned(game, actor, propertyId);
        if (!state.path("mortgaged").asBoolean()) {
            throw new StateConflictException("Property " + propertyId + " is not mortgaged");
        }
        if (actor.getBalance() < cost) {
            throw new StateConflictException("Insufficient funds to unmortgage " + propertyId);
        }
        state.put("mortgaged", false);
        actor.setBalance(actor.getBalance() - cost);
        Map<String, Object> d = detail("propertyId", propertyId);
        d.put("cost", cost);
        return ActionOutcome.of(d);
    }

    private ActionOutcome buildEngagement(Game game, Player actor, GameAction action) {
        String propertyId = required(action, "propertyId");
        long cost = amount(action, "cost");
        ObjectNode state = buildable(game, actor, propertyId, cost);
        int engagements = state.path("engagements").asInt();
        if (engagements >= MAX_ENGAGEMENTS || state.path("checkmark").asBoolean()) {
            throw new StateConflictException("Property " + propertyId + " cannot take more engagements");
        }
        state.put("engagements", engagements + 1);
        actor.debit(cost);
        Map<String, Object> d = detail("propertyId", propertyId);
        d.put("engagements", engagements + 1);
        return ActionOutcome.of(d);
    }

    private ActionOutcome buildCheckmark(Game game, Player actor, GameAction action) {
        String propertyId = required(action, "propertyId");
        long cost = amount(action, "cost");
        ObjectNode state = buildable(game, actor, propertyId, cost);
        if (state.path("engagements").asInt() < MAX_ENGAGEMENTS || state.path("checkmark").asBoolean()) {
            throw new StateConflictException("Property " + propertyId + " is not ready for a checkmark");
        }
        state.put("engagements", 0);
        state.put("checkmark", true);
        actor.debit(cost);
        return ActionOutcome.of(detail("propertyId", propertyId));
    }

    private ActionOutcome drawCard(Game game, GameAction action) {
        String deck = required(action, "cardType").toLowerCase();
        JsonNode decks = game.getBoard().path("cardsRemaining");
        if (!decks.has(deck)) {
            throw new ValidationException("Unknown card deck " + deck);
        }
        int remaining = decks.get(deck).asInt();
        if (remaining <= 0) {
            throw new StateConflictException("The " + deck + " deck is empty");
        }
        ((ObjectNode) decks).put(deck, remaining - 1);
        Map<String, Object> d = detail("cardType", deck);
        d.put("remaining", remaining - 1);
        return ActionOutcome.of(d);
    }

    private ActionOutcome trade(Game game, Player actor, GameAction action) {
        String toPlayerId = required(action, "toPlayerId");
        Player target = game.player(toPlayerId);
        if (target == null || target == actor || !target.getStatus().inPlay()) {
            throw new ValidationException("Trade target " + toPlayerId + " is not an opponent in play");
        }
        Map<String, Object> d = detail("toPlayerId", toPlayerId);
        d.put("offer", action.data().get("offer"));
        return ActionOutcome.of(d);
    }

    private ActionOutcome special(GameAction action) {
        Object effect = action.data().get("effect");
        Map<String, Object> d = new LinkedHashMap<>(action.data());
        if ("jail".equals(effect)) {
            return new ActionOutcome(d, true, true);
        }
        return ActionOutcome.of(d);
    }

    private ObjectNode owned(Game game, Player actor, String propertyId) {
        JsonNode state = properties(game).get(propertyId);
        if (state == null || !actor.getId().equals(state.path("owner").asText(null))) {
            throw new StateConflictException("Property " + propertyId + " is not owned by " + actor.getId());
        }
        return (ObjectNode) state;
    }

    private ObjectNode buildable(Game game, Player actor, String propertyId, long cost) {
        ObjectNode state = owned(game, actor, propertyId);
        if (state.path("mortgaged").asBoolean()) {
            throw new StateConflictException("Cannot build on mortgaged property " + propertyId);
        }
        if (actor.getBalance() < cost) {
            throw new StateConflictException("Insufficient funds to build on " + propertyId);
        }
        return state;
    }

    private static ObjectNode properties(Game game) {
        JsonNode props = game.getBoard().get("properties");
        if (props == null || !props.isObject()) {
            return game.getBoard().putObject("properties");
        }
        return (ObjectNode) props;
    }

    private static String required(GameAction action, String key) {
        Object v = action.data().get(key);
        if (v == null || v.toString().isBlank()) {
            throw new ValidationException(action.type() + " requires " + key);
        }
        return v.toString();
    }

    private static long amount(GameAction action, String key) {
        Object v = action.data().get(key);
        long value;
        if (v instanceof Number) {
            value = ((Number) v).longValue();
        } else if (v != null) {
            try {
                value = Long.parseLong(v.toString());
            } catch (NumberFormatException e) {
                throw new ValidationException(key + " must be a number", e);
            }
        } else {
            throw new ValidationException(action.type() + " requires " + key);
        }
        if (value < 0) {
            throw new ValidationException(key + " must not be negative");
        }
        return value;
    }

    private static Map<String, Object> detail(String key, Object value) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(key, value);
        return d;
    }
}
