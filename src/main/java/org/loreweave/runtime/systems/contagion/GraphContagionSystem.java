package org.loreweave.runtime.systems.contagion;

import com.typesafe.config.Config;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntityChanges;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;
import org.loreweave.runtime.systems.SystemResult;
import org.loreweave.runtime.systems.contagion.ContagionConfig.InfectionTarget;
import org.loreweave.runtime.systems.contagion.ContagionConfig.InfectionType;
import org.loreweave.runtime.systems.contagion.ContagionConfig.MarkerType;
import org.loreweave.runtime.systems.contagion.ContagionConfig.Vector;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Spreads a marker through a relationship network with a susceptible-infected-recovered model.
 * <p>
 * Each tick the population is split into infected, immune and susceptible entities. A susceptible
 * entity with infected contacts along the configured vectors is infected with probability
 * {@code (base + infectedContacts * multiplier) * (1 - susceptibility)}, capped by the maximum.
 * Infected entities recover with the recovery rate and gain the immunity tag.
 * </p>
 */
public class GraphContagionSystem implements ISimulationSystem {

    private final ContagionConfig config;

    public GraphContagionSystem(ContagionConfig config) {
        this.config = config;
    }

    public GraphContagionSystem(Config options) {
        this(ContagionConfig.fromConfig(options));
    }

    @Override
    public String getId() {
        return config.id();
    }

    @Override
    public String getName() {
        return config.name();
    }

    public ContagionConfig getConfig() {
        return config;
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        if (config.throttleChance() < 1.0 && !Probabilities.rollProbability(random, config.throttleChance(), modifier)) {
            return SystemResult.dormant(config.name() + ": dormant");
        }

        List<Entity> population = graph.findEntities(e -> config.entityKind().equals(e.getKind())
                && (config.entityStatus() == null || config.entityStatus().equals(e.getStatus())));
        List<Entity> infected = new ArrayList<>();
        List<Entity> susceptible = new ArrayList<>();
        for (Entity entity : population) {
            if (isInfected(graph, entity)) {
                infected.add(entity);
            } else if (!isImmune(entity)) {
                susceptible.add(entity);
            }
        }
        if (infected.isEmpty()) {
            return SystemResult.dormant(config.name() + ": no carriers");
        }

        SystemResult.Builder result = SystemResult.builder();
        int infections = 0;
        for (Entity entity : susceptible) {
            List<Entity> carriers = new ArrayList<>();
            for (Entity contact : contactsOf(graph, entity)) {
                if (isInfected(graph, contact)) carriers.add(contact);
            }
            if (carriers.isEmpty()) continue;

            double probability = (config.baseRate() + carriers.size() * config.contactMultiplier())
                    * (1 - susceptibilityOf(entity));
            probability = Math.min(config.maxProbability(), Math.max(0, probability));
            if (!Probabilities.rollProbability(random, probability, modifier)) continue;

            if (infect(graph, result, entity, carriers, random)) {
                infections++;
            }
        }

        if (config.recovery() != null) {
            for (Entity entity : infected) {
                double probability = config.recovery().baseRate();
                for (Map.Entry<String, Double> bonus : config.recovery().bonusTags().entrySet()) {
                    if (entity.getTags().has(bonus.getKey())) probability += bonus.getValue();
                }
                probability = Math.min(0.95, Math.max(0, probability));
                if (config.recovery().immunityTag() != null && Probabilities.rollProbability(random, probability, modifier)) {
                    EntityChanges changes = EntityChanges.create().putTag(config.recovery().immunityTag(), Boolean.TRUE);
                    if (config.marker().type() == MarkerType.TAG) {
                        changes.removeTag(config.marker().tag());
                    }
                    result.modify(entity.getId(), changes);
                }
            }
        }

        if (infections > 0 || result.modificationCount() > 0) {
            config.pressureChanges().forEach(result::pressure);
        }
        return result.build(config.name() + ": " + infections + " new infections, "
                + result.modificationCount() + " modifications");
    }

    private boolean infect(Graph graph, SystemResult.Builder result, Entity entity, List<Entity> carriers,
                           IRandomProvider random) {
        if (config.infection().type() == InfectionType.ADD_TAG) {
            result.modify(entity.getId(), EntityChanges.create()
                    .putTag(config.infection().tagKey(), config.infection().tagValue()));
            return true;
        }

        String kind = config.infection().relationshipKind();
        if (config.cooldown() > 0 && !result.canForm(graph, entity.getId(), kind, config.cooldown())) {
            return false;
        }
        Entity carrier = Probabilities.pickRandom(random, carriers);
        String target = carrier.getId();
        if (config.infection().target() == InfectionTarget.CONTAGION_SOURCE) {
            List<String> sources = new ArrayList<>(markerTargetsOf(graph, carrier));
            sources.remove(entity.getId());
            target = Probabilities.pickRandom(random, sources);
            if (target == null) return false;
        }
        if (target.equals(entity.getId()) || graph.hasRelationship(entity.getId(), target, kind)
                || result.isProposed(kind, entity.getId(), target)
                || GraphQueries.hasContradiction(graph, entity.getId(), target, kind)) {
            return false;
        }
        if (config.infection().strength() != null) {
            result.form(kind, entity.getId(), target, config.infection().strength());
        } else {
            result.form(kind, entity.getId(), target);
        }
        return true;
    }

    private boolean isInfected(Graph graph, Entity entity) {
        if (config.marker().type() == MarkerType.TAG) {
            return entity.getTags().has(config.marker().tag());
        }
        for (Relationship r : entity.getLinks()) {
            if (r.getKind().equals(config.marker().relationshipKind()) && r.getSrc().equals(entity.getId())
                    && graph.hasEntity(r.getDst())) {
                return true;
            }
        }
        return false;
    }

    private Set<String> markerTargetsOf(Graph graph, Entity entity) {
        Set<String> targets = new LinkedHashSet<>();
        for (Relationship r : entity.getLinks()) {
            if (r.getKind().equals(config.marker().relationshipKind()) && r.getSrc().equals(entity.getId())
                    && graph.hasEntity(r.getDst())) {
                targets.add(r.getDst());
            }
        }
        return targets;
    }

    private boolean isImmune(Entity entity) {
        return config.recovery() != null && config.recovery().immunityTag() != null
                && entity.getTags().has(config.recovery().immunityTag());
    }

    private Set<Entity> contactsOf(Graph graph, Entity entity) {
        Set<Entity> contacts = new LinkedHashSet<>();
        for (Vector vector : config.vectors()) {
            contacts.addAll(GraphQueries.getRelated(graph, entity.getId(), vector.relationshipKind(),
                    vector.direction(), vector.minStrength(), 1.0, false));
        }
        contacts.remove(entity);
        return contacts;
    }

    private double susceptibilityOf(Entity entity) {
        double total = 0;
        for (Map.Entry<String, Double> modifier : config.susceptibility().entrySet()) {
            if (entity.getTags().has(modifier.getKey())) total += modifier.getValue();
        }
        return total;
    }
}
