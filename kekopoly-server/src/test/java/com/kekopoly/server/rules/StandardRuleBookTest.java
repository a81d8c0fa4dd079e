package com.kekopoly.server.rules;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.kekopoly.server.error.StateConflictException;
import com.kekopoly.server.error.ValidationException;
import com.kekopoly.server.model.Game;
import com.kekopoly.server.model.GameAction;
import com.kekopoly.server.model.Player;
import com.kekopoly.shared.util.ActionType;

public class StandardRuleBookTest {

    private StandardRuleBook rules;
    private Game game;
    private Player alice;
    private Player bob;

    @BeforeEach
    public void setup() {
        rules = new StandardRuleBook(2);
        game = new Game();
        game.setId("g1");
        alice = new Player("alice", 1500, 0L);
        bob = new Player("bob", 1500, 0L);
        game.getPlayers().add(alice);
        game.getPlayers().add(bob);
        rules.initBoard(game);
    }

    private ActionOutcome apply(Player actor, ActionType type, Map<String, Object> data) {
        return rules.apply(game, actor, new GameAction(type, "g1", actor.getId(), null, data));
    }

    @Test
    public void testInitBoardSetsUpDecks() {
        assertEquals(2, game.getBoard().path("cardsRemaining").path("meme").asInt());
        assertTrue(game.getBoard().path("properties").isObject());
    }

    @Test
    public void testBuyPropertyRecordsOwnership() {
        apply(alice, ActionType.BUY_PROPERTY, Map.of("propertyId", "p1", "price", 200));

        assertEquals(1300, alice.getBalance());
        assertTrue(alice.getProperties().contains("p1"));
        assertEquals("alice", game.getBoard().path("properties").path("p1").path("owner").asText());
        assertThrows(StateConflictException.class,
            () -> apply(bob, ActionType.BUY_PROPERTY, Map.of("propertyId", "p1", "price", 200)));
    }

    @Test
    public void testBuyRequiresFunds() {
        assertThrows(StateConflictException.class,
            () -> apply(alice, ActionType.BUY_PROPERTY, Map.of("propertyId", "p1", "price", 5000)));
        assertEquals(1500, alice.getBalance());
    }

    @Test
    public void testRentMovesMoneyAndMayGoNegative() {
        apply(alice, ActionType.PAY_RENT, Map.of("ownerId", "bob", "amount", "1600"));

        assertEquals(-100, alice.getBalance());
        assertEquals(3100, bob.getBalance());
    }

    @Test
    public void testRentToSelfOrWithBadAmountIsInvalid() {
        assertThrows(ValidationException.class,
            () -> apply(alice, ActionType.PAY_RENT, Map.of("ownerId", "alice", "amount", 10)));
        assertThrows(ValidationException.class,
            () -> apply(alice, ActionType.PAY_RENT, Map.of("ownerId", "bob", "amount", "ten")));
        assertThrows(ValidationException.class,
            () -> apply(alice, ActionType.PAY_RENT, Map.of("ownerId", "bob", "amount", -5)));
    }

    @Test
    public void testMortgageCycle() {
        apply(alice, ActionType.BUY_PROPERTY, Map.of("propertyId", "p1", "price", 200));

        apply(alice, ActionType.MORTGAGE_PROPERTY, Map.of("propertyId", "p1", "value", 100));
        assertEquals(1400, alice.getBalance());
        assertThrows(StateConflictException.class,
            () -> apply(alice, ActionType.MORTGAGE_PROPERTY, Map.of("propertyId", "p1", "value", 100)));

        apply(alice, ActionType.UNMORTGAGE_PROPERTY, Map.of("propertyId", "p1", "value", 100));
        assertEquals(1290, alice.getBalance());
        assertThrows(StateConflictException.class,
            () -> apply(bob, ActionType.MORTGAGE_PROPERTY, Map.of("propertyId", "p1", "value", 100)));
    }

    @Test
    public void testCheckmarkNeedsFourEngagements() {
        apply(alice, ActionType.BUY_PROPERTY, Map.of("propertyId", "p1", "price", 100));
        assertThrows(StateConflictException.class,
            () -> apply(alice, ActionType.BUILD_CHECKMARK, Map.of("propertyId", "p1", "cost", 50)));

        for (int i = 0; i < StandardRuleBook.MAX_ENGAGEMENTS; i++) {
            apply(alice, ActionType.BUILD_ENGAGEMENT, Map.of("propertyId", "p1", "cost", 50));
        }
        assertThrows(StateConflictException.class,
            () -> apply(alice, ActionType.BUILD_ENGAGEMENT, Map.of("propertyId", "p1", "cost", 50)));

        apply(alice, ActionType.BUILD_CHECKMARK, Map.of("propertyId", "p1", "cost", 50));
        assertTrue(game.getBoard().path("properties").path("p1").path("checkmark").asBoolean());
        assertEquals(0, game.getBoard().path("properties").path("p1").path("engagements").asInt());
        assertEquals(1500 - 100 - 5 * 50, alice.getBalance());
    }

    @Test
    public void testDrawingEmptiesTheDeck() {
        apply(alice, ActionType.DRAW_CARD, Map.of("cardType", "MEME"));
        ActionOutcome last = apply(alice, ActionType.DRAW_CARD, Map.of("cardType", "meme"));

        assertEquals(0, last.detail().get("remaining"));
        assertThrows(StateConflictException.class, () -> apply(alice, ActionType.DRAW_CARD, Map.of("cardType", "meme")));
        assertThrows(ValidationException.class, () -> apply(alice, ActionType.DRAW_CARD, Map.of("cardType", "chance")));
    }

    @Test
    public void testTradeNeedsAnOpponent() {
        ActionOutcome outcome = apply(alice, ActionType.TRADE, Map.of("toPlayerId", "bob", "offer", "p1"));

        assertFalse(outcome.endsTurn());
        assertThrows(ValidationException.class, () -> apply(alice, ActionType.TRADE, Map.of("toPlayerId", "alice")));
    }

    @Test
    public void testJailEffectEndsTurn() {
        ActionOutcome outcome = apply(alice, ActionType.SPECIAL, Map.of("effect", "jail"));

        assertTrue(outcome.sendToJail());
        assertTrue(outcome.endsTurn());
        assertFalse(apply(alice, ActionType.SPECIAL, Map.of("effect", "bonus")).sendToJail());
    }

    @Test
    public void testRollIsNotARuleBookAction() {
        assertThrows(ValidationException.class, () -> apply(alice, ActionType.ROLL_DICE, Map.of()));
    }
}
