package org.loreweave.runtime.systems;

import com.typesafe.config.Config;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntityChanges;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Prominence;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fame and obscurity. Well connected entities rise one prominence level, isolated ones fade.
 * <p>
 * Thresholds scale with the current level so that each step up is harder than the last. Factions
 * rise when their core members are on average more prominent than the faction itself. Only living
 * NPCs are evaluated; the dead keep the prominence they died with.
 * </p>
 */
public class ProminenceEvolutionSystem implements ISimulationSystem {

    private final double npcGainChance;
    private final double npcDecayChance;
    private final double locationGainChance;
    private final double locationDecayChance;
    private final double abilityGainChance;
    private final double abilityDecayChance;
    private final double ruleGainChance;
    private final double ruleDecayChance;

    public ProminenceEvolutionSystem(Config options) {
        this.npcGainChance = doubleOr(options, "npc-gain-chance", 0.3);
        this.npcDecayChance = doubleOr(options, "npc-decay-chance", 0.7);
        this.locationGainChance = doubleOr(options, "location-gain-chance", 0.4);
        this.locationDecayChance = doubleOr(options, "location-decay-chance", 0.5);
        this.abilityGainChance = doubleOr(options, "ability-gain-chance", 0.35);
        this.abilityDecayChance = doubleOr(options, "ability-decay-chance", 0.4);
        this.ruleGainChance = doubleOr(options, "rule-gain-chance", 0.3);
        this.ruleDecayChance = doubleOr(options, "rule-decay-chance", 0.5);
    }

    @Override
    public String getId() {
        return "prominence_evolution";
    }

    @Override
    public String getName() {
        return "Fame and Obscurity";
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        Map<String, Integer> connections = new HashMap<>();
        Map<String, Integer> practitioners = new HashMap<>();
        for (Relationship r : graph.getRelationships()) {
            connections.merge(r.getSrc(), 1, Integer::sum);
            if (!r.getSrc().equals(r.getDst())) connections.merge(r.getDst(), 1, Integer::sum);
            if (RelationshipKinds.PRACTITIONER_OF.equals(r.getKind())) practitioners.merge(r.getDst(), 1, Integer::sum);
        }

        SystemResult.Builder result = SystemResult.builder();
        for (Entity entity : graph.getEntities()) {
            int level = entity.getProminence().ordinal();
            int score = connections.getOrDefault(entity.getId(), 0);
            int delta = 0;
            switch (entity.getKind()) {
                case "npc": {
                    if (!"alive".equals(entity.getStatus())) break;
                    int roleBonus = "hero".equals(entity.getSubtype()) || "mayor".equals(entity.getSubtype()) ? 2 : 0;
                    if (score + roleBonus >= (level + 1) * 6) {
                        if (random.nextDouble() < npcGainChance * modifier) delta = 1;
                    } else if (score < level * 2 && random.nextDouble() > 1 - npcDecayChance) {
                        delta = -1;
                    }
                    break;
                }
                case "faction": {
                    List<Entity> core = GraphQueries.getFactionMembers(graph, entity.getId(), 0.6);
                    int memberProminence = 0;
                    for (Entity member : core) memberProminence += member.getProminence().ordinal();
                    if (memberProminence > level * core.size()) delta = 1;
                    break;
                }
                case "location": {
                    int typeBonus = "colony".equals(entity.getSubtype()) || "anomaly".equals(entity.getSubtype()) ? 3 : 0;
                    if (score + typeBonus >= (level + 1) * 5 && random.nextDouble() < locationGainChance * modifier) {
                        delta = 1;
                    } else if (score < level * 2 && random.nextDouble() > 1 - locationDecayChance) {
                        delta = -1;
                    }
                    break;
                }
                case "abilities": {
                    int count = practitioners.getOrDefault(entity.getId(), 0);
                    if (count > (level + 1) * 3 && random.nextDouble() < abilityGainChance * modifier) {
                        delta = 1;
                    } else if (count < level && random.nextDouble() > 1 - abilityDecayChance) {
                        delta = -1;
                    }
                    break;
                }
                case "rules": {
                    boolean enacted = "enacted".equals(entity.getStatus());
                    int statusBonus = enacted ? 3 : 0;
                    if (score + statusBonus > (level + 1) * 4 && random.nextDouble() < ruleGainChance * modifier) {
                        delta = 1;
                    } else if (score == 0 && !enacted && random.nextDouble() > 1 - ruleDecayChance) {
                        delta = -1;
                    }
                    break;
                }
                default:
                    break;
            }
            Prominence next = entity.getProminence().shift(delta);
            if (delta != 0 && next != entity.getProminence()) {
                result.modify(entity.getId(), EntityChanges.create().prominence(next));
            }
        }
        return result.build("Prominence shifts for " + result.modificationCount() + " entities");
    }

    private static double doubleOr(Config options, String path, double fallback) {
        return options.hasPath(path) ? options.getDouble(path) : fallback;
    }
}
