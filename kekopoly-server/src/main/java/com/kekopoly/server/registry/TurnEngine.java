package com.kekopoly.server.registry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kekopoly.server.config.ServerConfig;
import com.kekopoly.server.model.Game;
import com.kekopoly.server.model.GameAction;
import com.kekopoly.server.model.Player;
import com.kekopoly.server.rules.ActionOutcome;
import com.kekopoly.server.rules.DiceRoll;
import com.kekopoly.server.rules.DiceRoller;
import com.kekopoly.server.rules.RuleBook;
import com.kekopoly.shared.dto.ActionResultDTO;
import com.kekopoly.shared.dto.DiceRolledDTO;
import com.kekopoly.shared.dto.GameEndedDTO;
import com.kekopoly.shared.dto.GameTurnDTO;
import com.kekopoly.shared.dto.JailEventDTO;
import com.kekopoly.shared.dto.PlayerPresenceDTO;
import com.kekopoly.shared.dto.TurnChangedDTO;
import com.kekopoly.shared.util.EventType;
import com.kekopoly.shared.util.GameStatus;
import com.kekopoly.shared.util.PlayerStatus;

/**
 * Movement, jail and turn rotation. Stateless; every method runs under the
 * owning session's lock and returns the events it produced.
 */
final class TurnEngine {

    private final ServerConfig.Game settings;
    private final DiceRoller dice;
    private final RuleBook rules;
    private final Clock clock;

    TurnEngine(ServerConfig.Game settings, DiceRoller dice, RuleBook rules, Clock clock) {
        this.settings = settings;
        this.dice = dice;
        this.rules = rules;
        this.clock = clock;
    }

    record Roll(DiceRoll dice, List<GameEvent> events) {}

    Roll roll(Game g, Player p, String requestId) {
        DiceRoll roll = dice.roll();
        List<GameEvent> events = new ArrayList<>();
        int from = p.getPosition();

        if (p.isInJail()) {
            boolean release = roll.doubles();
            if (!release) {
                p.setJailTurns(Math.max(0, p.getJailTurns() - 1));
                release = p.getJailTurns() == 0;
            }
            boolean passed = false;
            if (release) {
                p.setInJail(false);
                p.setJailTurns(0);
                p.setConsecutiveDoubles(0);
                passed = move(p, roll.sum());
            }
            events.add(diceRolled(g, p, requestId, roll, from, passed, false));
            events.add(new GameEvent(EventType.JAIL_EVENT,
                new JailEventDTO(g.getId(), p.getId(), p.isInJail(), p.getJailTurns(), release, p.getPosition())));
            events.addAll(advanceTurn(g, release ? "jail_release" : "jailed"));
            return new Roll(roll, events);
        }

        p.setConsecutiveDoubles(roll.doubles() ? p.getConsecutiveDoubles() + 1 : 0);
        if (roll.doubles() && p.getConsecutiveDoubles() >= settings.getMaxConsecutiveDoubles()) {
            sendToJail(p);
            events.add(diceRolled(g, p, requestId, roll, from, false, false));
            events.add(jailEntered(g, p));
            events.addAll(advanceTurn(g, "sent_to_jail"));
            return new Roll(roll, events);
        }

        boolean passed = move(p, roll.sum());
        boolean extraTurn = roll.doubles();
        events.add(diceRolled(g, p, requestId, roll, from, passed, extraTurn));
        if (!extraTurn) {
            events.addAll(advanceTurn(g, "roll"));
        }
        return new Roll(roll, events);
    }

    List<GameEvent> endTurn(Game g, Player p) {
        p.setConsecutiveDoubles(0);
        return advanceTurn(g, "end_turn");
    }

    List<GameEvent> applyRule(Game g, Player p, GameAction action) {
        ActionOutcome outcome = rules.apply(g, p, action);
        List<GameEvent> events = new ArrayList<>();
        events.add(new GameEvent(EventType.ACTION_RESULT,
            new ActionResultDTO(g.getId(), p.getId(), action.type(), action.requestId(), outcome.detail())));
        if (outcome.sendToJail()) {
            sendToJail(p);
            events.add(jailEntered(g, p));
        }
        if ((outcome.endsTurn() || outcome.sendToJail()) && p.getId().equals(g.getCurrentTurn())) {
            events.addAll(advanceTurn(g, outcome.sendToJail() ? "sent_to_jail" : action.type().name().toLowerCase()));
        }
        return events;
    }

    /**
     * Moves {@code currentTurn} to the next ACTIVE entry of the turn order,
     * wrapping around. Disconnected players keep their seat but are skipped.
     */
    List<GameEvent> advanceTurn(Game g, String reason) {
        List<String> order = g.getTurnOrder();
        String previous = g.getCurrentTurn();
        if (order.isEmpty()) {
            g.setCurrentTurn(null);
            return List.of();
        }
        Player leaving = g.player(previous);
        if (leaving != null) leaving.setConsecutiveDoubles(0);

        int n = order.size();
        int idx = order.indexOf(previous);
        String next = null;
        for (int i = 1; i <= n; i++) {
            String candidate = order.get(((idx + i) % n + n) % n);
            Player cp = g.player(candidate);
            if (cp != null && cp.getStatus() == PlayerStatus.ACTIVE) {
                next = candidate;
                break;
            }
        }
        if (next == null) {
            next = idx >= 0 ? previous : order.get(0);
        }
        g.setCurrentTurn(next);

        List<GameEvent> events = new ArrayList<>(2);
        events.add(new GameEvent(EventType.TURN_CHANGED, new TurnChangedDTO(g.getId(), previous, next, reason)));
        events.add(new GameEvent(EventType.GAME_TURN, new GameTurnDTO(g.getId(), next, List.copyOf(order))));
        return events;
    }

    /** Takes a player out of the rotation, passing the turn on first if it was theirs. */
    List<GameEvent> removeFromTurnOrder(Game g, String playerId, String reason) {
        List<GameEvent> events = new ArrayList<>();
        if (playerId.equals(g.getCurrentTurn()) && g.getStatus() == GameStatus.ACTIVE) {
            events.addAll(advanceTurn(g, reason));
        }
        g.getTurnOrder().remove(playerId);
        if (playerId.equals(g.getCurrentTurn())) {
            g.setCurrentTurn(g.getTurnOrder().isEmpty() ? null : g.getTurnOrder().get(0));
        }
        return events;
    }

    /** Marks players with a negative balance bankrupt and ends the game when one remains. */
    List<GameEvent> settle(Game g) {
        List<GameEvent> events = new ArrayList<>();
        for (Player p : g.getPlayers()) {
            if (p.getBalance() < 0 && p.getStatus().inPlay()) {
                p.setStatus(PlayerStatus.BANKRUPT);
                releaseProperties(g, p);
                events.addAll(removeFromTurnOrder(g, p.getId(), "bankrupt"));
                events.add(new GameEvent(EventType.PLAYER_BANKRUPT,
                    new PlayerPresenceDTO(g.getId(), p.getId(), clock.millis())));
            }
        }
        events.addAll(checkCompletion(g, "bankruptcy"));
        return events;
    }

    List<GameEvent> checkCompletion(Game g, String reason) {
        if (g.getStatus() != GameStatus.ACTIVE && g.getStatus() != GameStatus.PAUSED) return List.of();
        if (g.inPlayCount() > 1) return List.of();
        String winner = null;
        for (Player p : g.getPlayers()) {
            if (p.getStatus().inPlay()) winner = p.getId();
        }
        g.setStatus(GameStatus.COMPLETED);
        g.setWinnerId(winner);
        g.setCurrentTurn(null);
        return List.of(new GameEvent(EventType.GAME_ENDED, new GameEndedDTO(g.getId(), winner, reason)));
    }

    /** Releases the player's properties and splits any positive balance among the others still in play. */
    void redistribute(Game g, Player p) {
        releaseProperties(g, p);
        long balance = p.getBalance();
        if (balance <= 0) return;
        List<Player> heirs = new ArrayList<>();
        for (Player other : g.getPlayers()) {
            if (other != p && other.getStatus().inPlay()) heirs.add(other);
        }
        if (heirs.isEmpty()) return;
        long share = balance / heirs.size();
        for (Player heir : heirs) heir.credit(share);
        p.debit(share * heirs.size());
    }

    void sendToJail(Player p) {
        p.setPosition(settings.getJailPosition());
        p.setInJail(true);
        p.setJailTurns(settings.getJailTurns());
        p.setConsecutiveDoubles(0);
    }

    private void releaseProperties(Game g, Player p) {
        JsonNode props = g.getBoard().get("properties");
        if (props instanceof ObjectNode) {
            Iterator<Map.Entry<String, JsonNode>> it = props.fields();
            while (it.hasNext()) {
                if (p.getId().equals(it.next().getValue().path("owner").asText(null))) it.remove();
            }
        }
        p.getProperties().clear();
    }

    private boolean move(Player p, int steps) {
        int target = p.getPosition() + steps;
        boolean passedStart = target >= settings.getBoardSize();
        if (passedStart) p.credit(settings.getPassStartReward());
        p.setPosition(target % settings.getBoardSize());
        return passedStart;
    }

    private GameEvent jailEntered(Game g, Player p) {
        return new GameEvent(EventType.JAIL_EVENT,
            new JailEventDTO(g.getId(), p.getId(), true, p.getJailTurns(), false, p.getPosition()));
    }

    private static GameEvent diceRolled(Game g, Player p, String requestId, DiceRoll roll, int from, boolean passed, boolean extra) {
        return new GameEvent(EventType.DICE_ROLLED, new DiceRolledDTO(g.getId(), p.getId(), requestId, roll.asList(),
            roll.doubles(), from, p.getPosition(), p.getBalance(), passed, extra));
    }
}
