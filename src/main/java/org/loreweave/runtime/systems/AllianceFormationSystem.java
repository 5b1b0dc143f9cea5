package org.loreweave.runtime.systems;

import com.typesafe.config.Config;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.model.Direction;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Factions at war with a common enemy become allies. Existing alliances and factions at war with each
 * other are skipped. Any new alliance raises stability by the configured bonus.
 */
public class AllianceFormationSystem implements ISimulationSystem {

    private final double allianceChance;
    private final double stabilityBonus;

    public AllianceFormationSystem(Config options) {
        this.allianceChance = options.hasPath("alliance-chance") ? options.getDouble("alliance-chance") : 0.5;
        this.stabilityBonus = options.hasPath("stability-bonus") ? options.getDouble("stability-bonus") : 5.0;
    }

    @Override
    public String getId() {
        return "alliance_formation";
    }

    @Override
    public String getName() {
        return "Strategic Alliances";
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        List<Entity> factions = graph.findEntities(e -> "faction".equals(e.getKind()));
        if (factions.size() < 2) {
            return SystemResult.dormant("0 alliances formed");
        }
        List<Set<String>> enemies = new ArrayList<>();
        for (Entity faction : factions) {
            Set<String> ids = new HashSet<>();
            for (Entity enemy : GraphQueries.getRelated(graph, faction.getId(), RelationshipKinds.AT_WAR_WITH, Direction.BOTH)) {
                ids.add(enemy.getId());
            }
            enemies.add(ids);
        }

        SystemResult.Builder result = SystemResult.builder();
        for (int i = 0; i < factions.size(); i++) {
            for (int j = i + 1; j < factions.size(); j++) {
                String a = factions.get(i).getId();
                String b = factions.get(j).getId();
                if (enemies.get(i).contains(b) || !sharesEnemy(enemies.get(i), enemies.get(j), a, b)) continue;
                if (graph.hasRelationship(a, b, RelationshipKinds.ALLIED_WITH)
                        || graph.hasRelationship(b, a, RelationshipKinds.ALLIED_WITH)
                        || GraphQueries.hasContradiction(graph, a, b, RelationshipKinds.ALLIED_WITH)) {
                    continue;
                }
                if (Probabilities.rollProbability(random, allianceChance, modifier)) {
                    result.relate(RelationshipKinds.ALLIED_WITH, a, b);
                }
            }
        }
        int formed = result.relationshipCount();
        if (formed > 0) {
            result.pressure("stability", stabilityBonus);
        }
        return result.build(formed + " alliances formed");
    }

    private static boolean sharesEnemy(Set<String> enemiesA, Set<String> enemiesB, String a, String b) {
        for (String enemy : enemiesA) {
            if (!enemy.equals(a) && !enemy.equals(b) && enemiesB.contains(enemy)) return true;
        }
        return false;
    }
}
