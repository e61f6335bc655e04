package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.exception.StructuralException;
import com.asad.lineup_tracker.model.Action;
import com.asad.lineup_tracker.model.GameRecord;
import com.asad.lineup_tracker.model.PlayerRecord;
import com.asad.lineup_tracker.model.TeamRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decodes NBA game JSON into a {@link GameRecord}, once, at the edge.
 *
 * <p>Accepted layouts:
 * <ul>
 *   <li>game page: {@code props.pageProps.game} + {@code props.pageProps.playByPlay.actions}</li>
 *   <li>live data: {@code game} with {@code game.actions}</li>
 *   <li>the game object itself, with {@code actions} at the top level</li>
 * </ul>
 * Field names are read NBA camelCase first, snake_case second.
 */
@Service
public class GameDataParser {

    private static final Logger log = LoggerFactory.getLogger(GameDataParser.class);

    private final ObjectMapper mapper;

    public GameDataParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** @throws StructuralException if the JSON is malformed or required parts are missing */
    @SuppressWarnings("unchecked")
    public GameRecord parse(InputStream in) {
        Map<String, Object> root;
        try {
            root = mapper.readValue(in, Map.class);
        } catch (JsonProcessingException ex) {
            throw new StructuralException("Game JSON is malformed: " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new StructuralException("Game JSON could not be read: " + ex.getMessage(), ex);
        }
        if (root == null) throw new StructuralException("Game JSON is empty");
        return parse(root);
    }

    public GameRecord parse(Map<String, Object> root) {
        Map<String, Object> props = asMap(root.get("props"));
        Map<String, Object> pageProps = props != null ? asMap(props.get("pageProps")) : null;

        Map<String, Object> game;
        if (pageProps != null && asMap(pageProps.get("game")) != null) game = asMap(pageProps.get("game"));
        else if (asMap(root.get("game")) != null) game = asMap(root.get("game"));
        else game = root;

        String gameId = firstNonEmpty(asString(game.get("gameId")), asString(game.get("game_id")));
        if (gameId == null) gameId = "Unknown";

        TeamRecord home = parseTeam(firstMap(game.get("homeTeam"), game.get("home_team")), "home");
        TeamRecord away = parseTeam(firstMap(game.get("awayTeam"), game.get("away_team")), "away");
        if (home.teamId() == away.teamId()) {
            throw new StructuralException("Home and away team ids are both " + home.teamId());
        }

        List<Object> rawActions = null;
        if (pageProps != null && asMap(pageProps.get("playByPlay")) != null) {
            rawActions = asList(asMap(pageProps.get("playByPlay")).get("actions"));
        }
        if (rawActions == null) rawActions = asList(game.get("actions"));
        if (rawActions == null) rawActions = asList(root.get("actions"));
        if (rawActions == null) throw new StructuralException("Game " + gameId + " has no action list");

        List<Action> actions = new ArrayList<>();
        for (Object o : rawActions) {
            Map<String, Object> a = asMap(o);
            if (a == null) continue;

            Action action = parseAction(a);
            if (action == null) {
                log.warn("Game {}: skipping action without period or action number: {}", gameId, a);
                continue;
            }
            actions.add(action);
        }

        return new GameRecord(gameId, home, away, actions);
    }

    private TeamRecord parseTeam(Map<String, Object> team, String side) {
        if (team == null) throw new StructuralException("Missing " + side + " team");

        Long teamId = firstLong(team.get("teamId"), team.get("team_id"), team.get("id"));
        if (teamId == null) throw new StructuralException("Missing " + side + " team id");

        List<Object> rawPlayers = asList(team.get("players"));
        if (rawPlayers == null) throw new StructuralException("Missing " + side + " team players");

        List<PlayerRecord> players = new ArrayList<>();
        for (Object o : rawPlayers) {
            Map<String, Object> p = asMap(o);
            if (p == null) continue;

            Long personId = firstLong(p.get("personId"), p.get("person_id"), p.get("id"));
            if (personId == null) {
                log.warn("Skipping {} player without id: {}", side, p);
                continue;
            }

            Map<String, Object> stats = asMap(p.get("statistics"));
            String minutes = stats != null ? asString(stats.get("minutes")) : null;
            if (minutes == null) minutes = asString(p.get("minutes"));

            players.add(new PlayerRecord(
                    personId,
                    firstNonEmpty(asString(p.get("firstName")), asString(p.get("first_name"))),
                    firstNonEmpty(asString(p.get("familyName")), asString(p.get("family_name"))),
                    firstNonEmpty(asString(p.get("nameI")), asString(p.get("display_name")), asString(p.get("playerNameI"))),
                    firstNonEmpty(asString(p.get("jerseyNum")), asString(p.get("jersey"))),
                    asString(p.get("position")),
                    minutes
            ));
        }

        String tricode = firstNonEmpty(asString(team.get("teamTricode")), asString(team.get("tricode")));
        return new TeamRecord(teamId, tricode, players);
    }

    private Action parseAction(Map<String, Object> a) {
        Integer actionNumber = firstInt(a.get("actionNumber"), a.get("action_number"));
        Integer period = asInteger(a.get("period"));
        if (actionNumber == null || period == null || period < 1) return null;

        return new Action(
                actionNumber,
                period,
                asString(a.get("clock")),
                zeroToNull(firstLong(a.get("teamId"), a.get("team_id"))),
                zeroToNull(firstLong(a.get("personId"), a.get("person_id"))),
                firstNonEmpty(asString(a.get("playerName")), asString(a.get("player_name")), asString(a.get("playerNameI"))),
                firstNonEmpty(asString(a.get("actionType")), asString(a.get("action_type"))),
                asString(a.get("description"))
        );
    }

    // ---------------- helpers ----------------

    // the feed uses 0 for "no team" / "no player" on game-level actions
    private Long zeroToNull(Long v) {
        return (v == null || v == 0L) ? null : v;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object o) {
        return (o instanceof Map) ? (Map<String, Object>) o : null;
    }

    private Map<String, Object> firstMap(Object... objs) {
        for (Object o : objs) {
            Map<String, Object> m = asMap(o);
            if (m != null) return m;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private List<Object> asList(Object o) {
        return (o instanceof List) ? (List<Object>) o : null;
    }

    private Integer asInteger(Object o) {
        if (o == null) return null;
        if (o instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(o.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Long asLong(Object o) {
        if (o == null) return null;
        if (o instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(o.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Integer firstInt(Object... objs) {
        for (Object o : objs) {
            Integer i = asInteger(o);
            if (i != null) return i;
        }
        return null;
    }

    private Long firstLong(Object... objs) {
        for (Object o : objs) {
            Long l = asLong(o);
            if (l != null) return l;
        }
        return null;
    }

    private String asString(Object o) {
        return o == null ? null : o.toString();
    }

    private String firstNonEmpty(String... vals) {
        for (String v : vals) if (v != null && !v.trim().isEmpty()) return v.trim();
        return null;
    }
}
