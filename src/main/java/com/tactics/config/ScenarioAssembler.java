package com.tactics.config;

import com.tactics.exception.ConfigurationException;
import com.tactics.model.BoardConfig;
import com.tactics.model.Hex;
import com.tactics.model.Scenario;
import com.tactics.model.Unit;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a raw {@link ScenarioDefinition} into a validated {@link Scenario}.
 * Every problem is reported as a {@link ConfigurationException}.
 */
@Component
@RequiredArgsConstructor
public class ScenarioAssembler {

    private final Armory armory;
    private final Validator validator;

    public Scenario assemble(ScenarioDefinition definition) {
        if (definition == null) {
            throw new ConfigurationException("Scenario definition is missing");
        }
        Set<ConstraintViolation<ScenarioDefinition>> violations = validator.validate(definition);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ConfigurationException("Invalid scenario '" + definition.id() + "': " + details);
        }

        BoardConfig board = buildBoard(definition);
        List<Unit> units = buildUnits(definition, board);

        return new Scenario(definition.id(),
                definition.name() != null ? definition.name() : definition.id(),
                board, units, definition.maxTurns());
    }

    private BoardConfig buildBoard(ScenarioDefinition definition) {
        BoardDefinition boardDef = definition.board();
        Set<Hex> walls = new LinkedHashSet<>();
        if (boardDef.walls() != null) {
            for (List<Integer> pair : boardDef.walls()) {
                if (pair == null || pair.size() != 2 || pair.contains(null)) {
                    throw new ConfigurationException("Scenario '" + definition.id()
                            + "': wall entries must be [col, row] pairs, got " + pair);
                }
                Hex wall = Hex.of(pair.get(0), pair.get(1));
                if (!walls.add(wall)) {
                    throw new ConfigurationException("Scenario '" + definition.id() + "': duplicate wall " + wall);
                }
            }
        }
        return new BoardConfig(boardDef.cols(), boardDef.rows(), walls);
    }

    private List<Unit> buildUnits(ScenarioDefinition definition, BoardConfig board) {
        List<Unit> units = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        Map<Hex, String> occupied = new HashMap<>();
        Set<Integer> players = new HashSet<>();

        for (UnitDefinition def : definition.units()) {
            String where = "Scenario '" + definition.id() + "', unit '" + def.id() + "'";
            if (!ids.add(def.id())) {
                throw new ConfigurationException(where + ": duplicate unit id");
            }
            Hex position = Hex.of(def.col(), def.row());
            if (!board.inBounds(position)) {
                throw new ConfigurationException(where + ": position " + position + " is out of bounds");
            }
            if (board.isWall(position)) {
                throw new ConfigurationException(where + ": position " + position + " is a wall");
            }
            String other = occupied.putIfAbsent(position, def.id());
            if (other != null) {
                throw new ConfigurationException(where + ": position " + position + " already holds unit '" + other + "'");
            }
            int models = def.models() != null ? def.models() : 1;
            if (models > def.hpMax()) {
                throw new ConfigurationException(where + ": " + models + " models cannot share " + def.hpMax() + " wounds");
            }
            if (def.rangedWeapon() == null && def.meleeWeapon() == null) {
                throw new ConfigurationException(where + ": unit has no weapon");
            }

            units.add(Unit.builder()
                    .id(def.id())
                    .name(def.name() != null ? def.name() : def.id())
                    .player(def.player())
                    .position(position)
                    .hp(def.hpMax())
                    .hpMax(def.hpMax())
                    .models(models)
                    .move(def.move())
                    .toughness(def.toughness())
                    .armorSave(def.armorSave())
                    .invulSave(def.invulSave() != null ? def.invulSave() : 0)
                    .rangedWeapon(def.rangedWeapon() != null ? armory.getWeapon(def.rangedWeapon()) : null)
                    .meleeWeapon(def.meleeWeapon() != null ? armory.getWeapon(def.meleeWeapon()) : null)
                    .blocksLineOfSight(Boolean.TRUE.equals(def.blocksLos()))
                    .build());
            players.add(def.player());
        }

        if (!players.containsAll(Set.of(0, 1))) {
            throw new ConfigurationException("Scenario '" + definition.id() + "' needs units for both players, found " + players);
        }
        return units;
    }
}
