package com.skillq.skill;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillq.config.SkillQProperties;
import com.skillq.error.FormulaValidationException;
import com.skillq.error.NotFoundException;
import com.skillq.error.SkillQException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog of skills by name plus their validated formula configuration.
 * Holds no execution state.
 */
@Component
public class SkillRegistry {

    private static final Logger log = LoggerFactory.getLogger(SkillRegistry.class);

    public static final String SKILL_DISABLED = "SKILL_DISABLED";

    private final Map<String, Skill<?>> skills = new ConcurrentHashMap<>();
    private final Map<String, CachedConfig> configCache = new ConcurrentHashMap<>();
    private final SkillConfigRepository configRepository;
    private final long configTtlNanos;

    public SkillRegistry(List<Skill<?>> skills, SkillConfigRepository configRepository, SkillQProperties properties) {
        this.configRepository = configRepository;
        Duration ttl = properties.getSkills().getConfigCacheTtl();
        this.configTtlNanos = ttl == null ? 0L : ttl.toNanos();
        for (Skill<?> skill : skills) {
            register(skill);
        }
    }

    /**
     * Adds a skill, replacing any skill already registered under the same name.
     */
    public void register(Skill<?> skill) {
        Skill<?> previous = skills.put(skill.name(), skill);
        if (previous != null && previous != skill) {
            log.warn("Skill '{}' v{} replaced previously registered v{}", skill.name(), skill.version(),
                    previous.version());
        } else {
            log.info("Registered skill '{}' v{}", skill.name(), skill.version());
        }
    }

    public Skill<?> get(String name) {
        Skill<?> skill = skills.get(name);
        if (skill == null) {
            throw new NotFoundException("Skill", name);
        }
        return skill;
    }

    public Optional<Skill<?>> find(String name) {
        return Optional.ofNullable(skills.get(name));
    }

    public boolean has(String name) {
        return skills.containsKey(name);
    }

    public List<String> list() {
        return List.copyOf(skills.keySet());
    }

    public Collection<Skill<?>> getAll() {
        return List.copyOf(skills.values());
    }

    public int count() {
        return skills.size();
    }

    public SkillDescriptor describe(String name) {
        return SkillDescriptor.of(get(name));
    }

    public List<SkillDescriptor> describeAll() {
        List<SkillDescriptor> descriptors = new ArrayList<>(skills.size());
        for (Skill<?> skill : skills.values()) {
            descriptors.add(SkillDescriptor.of(skill));
        }
        return descriptors;
    }

    /**
     * Loads the persisted configuration of a skill and checks it against {@link FormulaConstants}.
     *
     * @throws NotFoundException when no configuration row exists
     * @throws FormulaValidationException when any value differs from its canonical constant
     */
    public SkillConfig getConfig(String name) {
        long now = System.nanoTime();
        CachedConfig cached = configCache.get(name);
        if (cached != null && now - cached.loadedAtNanos() < configTtlNanos) {
            return cached.config();
        }

        SkillConfigEntity entity = configRepository.findBySkillName(name)
                .orElseThrow(() -> new NotFoundException("Skill configuration", name));
        if (!entity.isEnabled()) {
            throw new SkillQException("Skill '" + name + "' is disabled", SKILL_DISABLED, 503, false,
                    Map.of("skill", name));
        }

        SkillConfig config = toSkillConfig(entity);
        Map<String, Object> mismatches = FormulaConstants.mismatches(config);
        if (!mismatches.isEmpty()) {
            log.error("Configuration of skill '{}' does not match canonical formula constants: {}", name, mismatches);
            throw new FormulaValidationException(
                    "Configuration of skill '" + name + "' does not match canonical formula constants", mismatches);
        }

        configCache.put(name, new CachedConfig(config, now));
        try {
            configRepository.markValidated(name, OffsetDateTime.now());
        } catch (RuntimeException e) {
            log.warn("Could not record validation timestamp for skill '{}': {}", name, e.getMessage());
        }
        return config;
    }

    public void invalidateConfig(String name) {
        configCache.remove(name);
    }

    private SkillConfig toSkillConfig(SkillConfigEntity entity) {
        JsonNode rates = entity.getConversionRates();
        JsonNode thresholds = entity.getThresholds();
        return new SkillConfig(
                new SkillConfig.ConversionRates(
                        number(rates, "compactor_ypd"),
                        number(rates, "dumpster_ypd"),
                        number(rates, "target_capacity")),
                new SkillConfig.Thresholds(
                        number(thresholds, "compactor_tons"),
                        number(thresholds, "contamination_pct"),
                        number(thresholds, "bulk_monthly"),
                        number(thresholds, "leaseup_variance")));
    }

    private double number(JsonNode node, String field) {
        if (node == null) {
            return Double.NaN;
        }
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asDouble() : Double.NaN;
    }

    private record CachedConfig(SkillConfig config, long loadedAtNanos) {
    }
}
