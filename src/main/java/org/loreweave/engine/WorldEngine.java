package org.loreweave.engine;

import org.loreweave.runtime.Config;
import org.loreweave.runtime.internal.services.SeededRandomProvider;
import org.loreweave.runtime.model.Direction;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntityChanges;
import org.loreweave.runtime.model.Era;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.HistoryEvent;
import org.loreweave.runtime.model.Prominence;
import org.loreweave.runtime.mutation.CommitOutcome;
import org.loreweave.runtime.mutation.MutationCommitter;
import org.loreweave.runtime.mutation.TemplateResult;
import org.loreweave.runtime.pressure.PressureController;
import org.loreweave.runtime.pressure.PressureDefinition;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.IGrowthTemplate;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;
import org.loreweave.runtime.systems.EntityModification;
import org.loreweave.runtime.systems.SystemCommitter;
import org.loreweave.runtime.systems.SystemResult;
import org.loreweave.runtime.templates.MissingCapabilityException;
import org.loreweave.runtime.validation.ValidationReport;
import org.loreweave.runtime.validation.WorldValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives a world graph through eras, epochs and ticks.
 * <p>
 * One {@link #step()} runs one tick: every system in pipeline order (each committed before the next
 * runs), then the growth templates selected for the tick, then the pressure flush and growth
 * monitoring. When an epoch has run its ticks, pressures grow and decay, old entities are pruned and
 * the per-epoch discovery counter resets.
 * </p>
 * <p>
 * Errors follow three tiers. Empty results are normal. A missing capability or an invalid
 * configuration value is rethrown and ends the run. Any other exception from a template or system is
 * logged, recorded as an {@link OperationalError} and that unit contributes nothing for the tick.
 * </p>
 * The engine is single-threaded; {@link #abort()} may be called from another thread.
 */
public class WorldEngine {

    private static final Logger LOG = LoggerFactory.getLogger(WorldEngine.class);

    static final int PRUNE_MIN_AGE = 50;
    static final int PRUNE_MIN_CONNECTIONS = 2;
    static final int MORTALITY_MIN_AGE = 80;
    static final double MORTALITY_CHANCE = 0.3;
    static final String MORTALITY_MODIFIER = "mortality";
    static final double GROWTH_VARIANCE = 0.3;
    static final int MIN_GROWTH_TARGET = 3;
    static final int MAX_GROWTH_TARGET = 25;
    static final int AGGRESSIVE_WARNING_INTERVAL = 20;

    private final EngineSettings settings;
    private final IDomainSchema domain;
    private final List<PressureDefinition> pressureDefinitions;
    private final List<Era> eras;
    private final List<ISimulationSystem> systems;
    private final List<IGrowthTemplate> templates;
    private final SeedWorld seedWorld;
    private final MutationCommitter committer;
    private final SystemCommitter systemCommitter;
    private final WorldValidator validator;
    private final SeededRandomProvider random;
    private final byte[] initialRandomState;
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final Map<String, SystemMetric> systemMetrics = new HashMap<>();

    private Graph graph;
    private PressureController pressures;
    private List<IRandomProvider> systemRandoms;
    private List<IRandomProvider> templateRandoms;
    private int epoch;
    private boolean epochOpen;
    private int ticksInEpoch;
    private int epochGrowthTarget;
    private int epochGrowthCreated;
    private int lastRelationshipCount;

    private static final class SystemMetric {
        long relationshipsCreated;
        long lastWarningTick = -AGGRESSIVE_WARNING_INTERVAL - 1;
    }

    /**
     * Creates an engine and builds the seed graph.
     *
     * @param eras era sequence; must not be empty
     * @throws IllegalArgumentException if no era is configured
     */
    public WorldEngine(EngineSettings settings,
                       IDomainSchema domain,
                       List<PressureDefinition> pressureDefinitions,
                       List<Era> eras,
                       List<ISimulationSystem> systems,
                       List<IGrowthTemplate> templates,
                       SeedWorld seedWorld) {
        this.settings = Objects.requireNonNull(settings, "Engine settings cannot be null.");
        this.domain = Objects.requireNonNull(domain, "Domain schema cannot be null.");
        this.pressureDefinitions = List.copyOf(pressureDefinitions);
        this.eras = List.copyOf(eras);
        if (this.eras.isEmpty()) {
            throw new IllegalArgumentException("At least one era must be configured.");
        }
        this.systems = List.copyOf(systems);
        this.templates = List.copyOf(templates);
        this.seedWorld = seedWorld != null ? seedWorld : SeedWorld.empty();
        this.committer = new MutationCommitter(domain);
        this.systemCommitter = new SystemCommitter(committer);
        this.validator = new WorldValidator(domain);
        this.random = new SeededRandomProvider(settings.seed());
        this.initialRandomState = random.saveState();
        reset();
    }

    /**
     * Restores the seed graph at tick 0 with the initial random state and clears errors and the abort flag.
     */
    public void reset() {
        random.loadState(initialRandomState);
        graph = new Graph(random.deriveFor("graph", 0));
        graph.setCurrentEra(eras.get(0));
        pressures = new PressureController(graph, pressureDefinitions, settings.maxPressureDeltaPerTick());
        pressures.initialize();

        systemRandoms = new ArrayList<>(systems.size());
        for (int i = 0; i < systems.size(); i++) {
            systemRandoms.add(random.deriveFor("system", i));
        }
        templateRandoms = new ArrayList<>(templates.size());
        for (int i = 0; i < templates.size(); i++) {
            templateRandoms.add(random.deriveFor("template", i));
        }

        epoch = 0;
        epochOpen = false;
        ticksInEpoch = 0;
        epochGrowthTarget = 0;
        epochGrowthCreated = 0;
        errors.clear();
        systemMetrics.clear();
        aborted.set(false);

        List<String> seeded = seedWorld.applyTo(graph, domain);
        lastRelationshipCount = graph.getRelationships().size();
        graph.addHistoryEvent(new HistoryEvent(0, graph.getCurrentEra().id(), "special",
                String.format("World initialized: %d entities, %d relationships", seeded.size(), lastRelationshipCount),
                seeded, lastRelationshipCount, List.of()));
    }

    /**
     * Runs steps until a stop condition holds.
     *
     * @return the final graph
     * @throws MissingCapabilityException if a template needs a capability the domain does not configure
     */
    public Graph run() {
        LOG.info("Starting world generation: seed {}, {} entities, {} systems, {} templates, {} eras",
                settings.seed(), graph.getEntityCount(), systems.size(), templates.size(), eras.size());
        while (step()) {
            // one tick per iteration
        }
        LOG.info("World generation finished at tick {} after {} epochs: {} entities, {} relationships{}",
                graph.getTick(), epoch, graph.getEntityCount(), graph.getRelationships().size(),
                aborted.get() ? " (aborted)" : "");
        return graph;
    }

    /**
     * Runs one tick.
     *
     * @return false if a stop condition already held and nothing was run
     */
    public boolean step() {
        if (!shouldContinue()) {
            return false;
        }
        if (!epochOpen) {
            openEpoch();
        }
        Era era = graph.getCurrentEra();
        runSystems(era);
        runTemplates(era);
        Map<String, Double> applied = pressures.flush();
        if (!applied.isEmpty()) {
            LOG.debug("Tick {} pressure deltas: {}", graph.getTick(), applied);
        }
        monitorRelationshipGrowth();
        graph.advanceTick();
        ticksInEpoch++;
        if (ticksInEpoch >= settings.ticksPerEpoch()) {
            closeEpoch(era);
        }
        return true;
    }

    /**
     * Requests the run to stop after the current tick.
     */
    public void abort() {
        if (aborted.compareAndSet(false, true)) {
            LOG.info("Abort requested at tick {}", graph.getTick());
        }
    }

    /**
     * Runs the four validation checks over the current graph.
     */
    public ValidationReport validate() {
        return validator.validateWorld(graph);
    }

    boolean shouldContinue() {
        if (aborted.get()) return false;
        if (graph.getTick() >= settings.maxTicks()) return false;
        if (epoch >= eras.size() * settings.epochsPerEra()) return false;
        return graph.getEntityCount() < settings.targetPopulation();
    }

    // ---------------------------------------------------------------- epochs

    private void openEpoch() {
        Era previous = graph.getCurrentEra();
        Era era = eraForEpoch(epoch);
        graph.setCurrentEra(era);
        if (!era.id().equals(previous.id())) {
            graph.addHistoryEvent(new HistoryEvent(graph.getTick(), era.id(), "special",
                    "Era changed: " + previous.name() + " -> " + era.name(), List.of(), 0, List.of()));
        }
        epochGrowthTarget = calculateGrowthTarget();
        epochGrowthCreated = 0;
        epochOpen = true;
        LOG.info("=== Epoch {}: {} (growth target {}) ===", epoch, era.name(), epochGrowthTarget);
    }

    private void closeEpoch(Era era) {
        pressures.updateEpoch(era);
        pruneAndConsolidate(era);
        reportEpochStats();
        graph.getDiscoveryState().resetEpoch();
        epoch++;
        epochOpen = false;
        ticksInEpoch = 0;
    }

    Era eraForEpoch(int epochIndex) {
        return eras.get(Math.min(epochIndex / settings.epochsPerEra(), eras.size() - 1));
    }

    /**
     * Remaining deficit over the growth kinds spread over the remaining epochs, with variance,
     * clamped to [3, 25].
     */
    int calculateGrowthTarget() {
        int totalRemaining = 0;
        for (String kind : settings.growthKinds()) {
            totalRemaining += deficit(kind);
        }
        if (totalRemaining == 0) {
            return MIN_GROWTH_TARGET;
        }
        int epochsRemaining = Math.max(1, eras.size() * settings.epochsPerEra() - epoch);
        int base = (int) Math.ceil((double) totalRemaining / epochsRemaining);
        double factor = 1 - GROWTH_VARIANCE + random.nextDouble() * GROWTH_VARIANCE * 2;
        int target = (int) Math.floor(base * factor);
        return Math.max(MIN_GROWTH_TARGET, Math.min(MAX_GROWTH_TARGET, target));
    }

    private int deficit(String kind) {
        return Math.max(0, settings.targetEntitiesPerKind() - graph.getEntityCount(kind, null));
    }

    private void pruneAndConsolidate(Era era) {
        long tick = graph.getTick();
        int forgotten = 0;
        for (Entity entity : new ArrayList<>(graph.getEntities())) {
            if (entity.getProminence() == Prominence.FORGOTTEN) continue;
            long age = tick - entity.getCreatedAt();
            if (age > PRUNE_MIN_AGE
                    && graph.getEntityRelationships(entity.getId(), Direction.BOTH).size() < PRUNE_MIN_CONNECTIONS) {
                graph.updateEntity(entity.getId(), EntityChanges.create().prominence(Prominence.FORGOTTEN));
                forgotten++;
            }
        }

        double deathChance = MORTALITY_CHANCE * era.systemModifier(MORTALITY_MODIFIER);
        int died = 0;
        for (Entity npc : graph.findEntities(e -> "npc".equals(e.getKind()) && "alive".equals(e.getStatus()))) {
            if (tick - npc.getCreatedAt() > MORTALITY_MIN_AGE && random.nextDouble() < deathChance) {
                graph.updateEntity(npc.getId(), EntityChanges.create().status("dead"));
                died++;
            }
        }
        if (forgotten > 0 || died > 0) {
            LOG.debug("Epoch {} consolidation: {} entities forgotten, {} npcs died", epoch, forgotten, died);
        }
    }

    private void reportEpochStats() {
        Map<String, Integer> byKind = new TreeMap<>();
        for (Entity entity : graph.getEntities()) {
            byKind.merge(entity.getKind(), 1, Integer::sum);
        }
        Map<String, String> pressureValues = new TreeMap<>();
        graph.getPressures().forEach((id, value) -> pressureValues.put(id, String.format("%.1f", value)));
        LOG.info("Epoch {} closed at tick {}: entities {} (+{} this epoch), relationships {}, pressures {}",
                epoch, graph.getTick(), byKind, epochGrowthCreated, graph.getRelationships().size(), pressureValues);
    }

    // ---------------------------------------------------------------- systems

    private void runSystems(Era era) {
        int budgetLeft = settings.maxRelationshipsPerTick();
        boolean budgetWarned = false;
        int relationshipsAdded = 0;
        List<String> modifiedIds = new ArrayList<>();
        List<String> createdIds = new ArrayList<>();

        for (int i = 0; i < systems.size(); i++) {
            ISimulationSystem system = systems.get(i);
            double modifier = era.systemModifier(system.getId());
            if (modifier == 0) continue;

            SystemResult result;
            CommitOutcome outcome;
            try {
                result = system.apply(graph, modifier, systemRandoms.get(i));
                outcome = systemCommitter.commit(graph, result, budgetLeft);
                for (EntityModification modification : result.getEntitiesModified()) {
                    if (graph.updateEntity(modification.id(), modification.changes())) {
                        modifiedIds.add(modification.id());
                    }
                }
            } catch (MissingCapabilityException e) {
                throw e;
            } catch (RuntimeException e) {
                LOG.warn("System {} failed at tick {}: {}", system.getId(), graph.getTick(), e.getMessage());
                recordError("SYSTEM_FAILED", "System " + system.getId() + " failed: " + e.getMessage(),
                        String.format("Tick: %d", graph.getTick()));
                continue;
            }

            budgetLeft -= outcome.relationshipsAdded();
            relationshipsAdded += outcome.relationshipsAdded();
            createdIds.addAll(outcome.createdIds());
            if (budgetLeft <= 0 && outcome.relationshipsSkipped() > 0 && !budgetWarned) {
                LOG.warn("Relationship budget of {} per tick reached at tick {} by {}, dropping remaining proposals",
                        settings.maxRelationshipsPerTick(), graph.getTick(), system.getId());
                budgetWarned = true;
            }
            trackSystemMetric(system, outcome.relationshipsAdded());
            pressures.proposeAll(result.getPressureChanges());

            if (!result.isEmpty()) {
                LOG.debug("Tick {} {}: {}", graph.getTick(), system.getName(), result.getDescription());
            }
        }

        if (relationshipsAdded > 0 || !modifiedIds.isEmpty() || !createdIds.isEmpty()) {
            graph.addHistoryEvent(new HistoryEvent(graph.getTick(), era.id(), "simulation",
                    String.format("Systems: +%d relationships, %d modifications", relationshipsAdded, modifiedIds.size()),
                    createdIds, relationshipsAdded, modifiedIds));
        }
    }

    private void trackSystemMetric(ISimulationSystem system, int added) {
        SystemMetric metric = systemMetrics.computeIfAbsent(system.getId(), id -> new SystemMetric());
        metric.relationshipsCreated += added;
        if (metric.relationshipsCreated > settings.aggressiveSystemThreshold()
                && graph.getTick() - metric.lastWarningTick > AGGRESSIVE_WARNING_INTERVAL) {
            LOG.warn("Aggressive system {}: {} relationships created so far, consider throttling it",
                    system.getId(), metric.relationshipsCreated);
            metric.lastWarningTick = graph.getTick();
        }
    }

    // ---------------------------------------------------------------- templates

    private void runTemplates(Era era) {
        int quota = tickGrowthQuota();
        if (quota <= 0 || templates.isEmpty()) {
            return;
        }
        int created = 0;
        for (int index : selectTemplates(era, quota)) {
            if (created >= quota) break;
            IGrowthTemplate template = templates.get(index);
            IRandomProvider templateRandom = templateRandoms.get(index);
            try {
                if (!template.canApply(graph, templateRandom)) continue;
                List<Entity> targets = template.findTargets(graph, templateRandom);
                if (targets.isEmpty()) continue;
                Entity target = targets.get(random.nextInt(targets.size()));

                TemplateResult result = template.expand(graph, target, templateRandom);
                if (result.isEmpty()) {
                    LOG.debug("Tick {} {}: {}", graph.getTick(), template.getName(), result.getDescription());
                    continue;
                }
                CommitOutcome outcome = committer.commit(graph, result);
                pressures.proposeAll(result.getPressureChanges());
                if (result.isDiscovery() && !outcome.createdIds().isEmpty()) {
                    graph.getDiscoveryState().recordDiscovery(graph.getTick());
                }
                created += outcome.createdIds().size();
                graph.addHistoryEvent(new HistoryEvent(graph.getTick(), era.id(), "growth", result.getDescription(),
                        outcome.createdIds(), outcome.relationshipsAdded(), List.of()));
                LOG.debug("Tick {} {}: {}", graph.getTick(), template.getName(), result.getDescription());
            } catch (MissingCapabilityException e) {
                throw e;
            } catch (RuntimeException e) {
                LOG.warn("Template {} failed at tick {}: {}", template.getId(), graph.getTick(), e.getMessage());
                recordError("TEMPLATE_FAILED", "Template " + template.getId() + " failed: " + e.getMessage(),
                        String.format("Tick: %d", graph.getTick()));
            }
        }
        epochGrowthCreated += created;
    }

    /**
     * Per-tick share of what is left of the epoch growth target.
     */
    int tickGrowthQuota() {
        int remaining = epochGrowthTarget - epochGrowthCreated;
        if (remaining <= 0) return 0;
        int ticksLeft = Math.max(1, settings.ticksPerEpoch() - ticksInEpoch);
        return (int) Math.ceil((double) remaining / ticksLeft);
    }

    /**
     * Weighted sampling without replacement; weight = era weight × (0.5 + deficit / target × 2.5).
     *
     * @return template indices in selection order, at most three per unit of quota
     */
    List<Integer> selectTemplates(Era era, int quota) {
        List<Integer> pool = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (int i = 0; i < templates.size(); i++) {
            IGrowthTemplate template = templates.get(i);
            double eraWeight = era.templateWeight(template.getId());
            if (eraWeight <= 0) continue;
            String kind = template.getProducedKind();
            double deficitWeight = kind != null && settings.growthKinds().contains(kind) ? deficit(kind) + 1 : 1.0;
            pool.add(i);
            weights.add(eraWeight * (0.5 + deficitWeight / settings.targetEntitiesPerKind() * 2.5));
        }

        int selectCount = Math.min(pool.size(), quota * 3);
        List<Integer> selected = new ArrayList<>(selectCount);
        while (selected.size() < selectCount) {
            double total = 0;
            for (double w : weights) total += w;
            if (total <= 0) break;
            double roll = random.nextDouble() * total;
            int pick = weights.size() - 1;
            for (int j = 0; j < weights.size(); j++) {
                roll -= weights.get(j);
                if (roll <= 0) {
                    pick = j;
                    break;
                }
            }
            selected.add(pool.remove(pick));
            weights.remove(pick);
        }
        return selected;
    }

    // ---------------------------------------------------------------- monitoring

    private void monitorRelationshipGrowth() {
        int current = graph.getRelationships().size();
        double average = graph.getGrowthMetrics().record(current - lastRelationshipCount);
        if (graph.getGrowthMetrics().isGrowthExcessive()) {
            LOG.warn("High relationship growth rate at tick {}: {} per tick, {} relationships total",
                    graph.getTick(), String.format("%.1f", average), current);
        }
        lastRelationshipCount = current;
    }

    private void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        while (errors.size() > Config.MAX_RECORDED_ERRORS) {
            errors.pollFirst();
        }
    }

    // ---------------------------------------------------------------- accessors

    public Graph getGraph() {
        return graph;
    }

    public PressureController getPressureController() {
        return pressures;
    }

    public EngineSettings getSettings() {
        return settings;
    }

    public IDomainSchema getDomain() {
        return domain;
    }

    public List<Era> getEras() {
        return eras;
    }

    public List<ISimulationSystem> getSystems() {
        return systems;
    }

    public List<IGrowthTemplate> getTemplates() {
        return templates;
    }

    /**
     * @return the index of the current (or next, between epochs) epoch
     */
    public int getEpoch() {
        return epoch;
    }

    public boolean isAborted() {
        return aborted.get();
    }

    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    public void clearErrors() {
        errors.clear();
    }
}
