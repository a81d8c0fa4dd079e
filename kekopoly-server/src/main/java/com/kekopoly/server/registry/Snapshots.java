package com.kekopoly.server.registry;

import java.util.ArrayList;
import java.util.List;

import com.kekopoly.server.model.Game;
import com.kekopoly.server.model.Player;
import com.kekopoly.shared.dto.CompleteStateDTO;
import com.kekopoly.shared.dto.GameInfoDTO;
import com.kekopoly.shared.dto.LobbyGameDTO;
import com.kekopoly.shared.dto.PlayerStateDTO;
import com.kekopoly.shared.util.GameStatus;

/** Game document to wire DTO conversions. */
public final class Snapshots {

    private Snapshots() {
    }

    public static PlayerStateDTO playerState(Player p) {
        return new PlayerStateDTO(p.getId(), p.getStatus(), p.getCharacterToken(), p.getPosition(), p.getBalance(),
            p.getNetWorth(), List.copyOf(p.getProperties()), p.isInJail(), p.getJailTurns(), p.getDisconnectedAt());
    }

    public static List<PlayerStateDTO> playerStates(Game g) {
        List<PlayerStateDTO> out = new ArrayList<>(g.getPlayers().size());
        for (Player p : g.getPlayers()) out.add(playerState(p));
        return out;
    }

    public static CompleteStateDTO completeState(Game g, long now) {
        return new CompleteStateDTO(g.getId(), g.getCode(), g.getName(), g.getStatus(), g.getHostId(),
            g.getCurrentTurn(), List.copyOf(g.getTurnOrder()), g.getMaxPlayers(), playerStates(g),
            g.getMarketCondition(), g.getWinnerId(), g.getBoard().deepCopy(), now);
    }

    public static GameInfoDTO gameInfo(Game g) {
        return new GameInfoDTO(g.getId(), g.getCode(), g.getName(), g.getStatus(), g.getHostId(), g.getCurrentTurn(),
            g.getMaxPlayers(), g.getPlayers().size(), g.getStatus() != GameStatus.LOBBY);
    }

    public static LobbyGameDTO lobbyGame(Game g) {
        return new LobbyGameDTO(g.getId(), g.getCode(), g.getName(), g.getHostId(), g.getPlayers().size(), g.getMaxPlayers());
    }
}
