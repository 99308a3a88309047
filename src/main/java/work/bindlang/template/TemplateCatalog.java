package work.bindlang.template;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.bindlang.engine.BindingEngine;
import work.bindlang.model.ConsumptionMode;
import work.bindlang.model.Guard;
import work.bindlang.model.Unit;

/**
 * Templates keyed by type pattern, producing validated units for an engine.
 */
public final class TemplateCatalog {
    private final BindingEngine engine;
    private final Map<String, UnitTemplate> templates = new LinkedHashMap<>();

    public TemplateCatalog(BindingEngine engine) {
        this.engine = engine;
    }

    public TemplateCatalog register(UnitTemplate template) {
        templates.put(template.typePattern(), template);
        return this;
    }

    public TemplateCatalog registerAll(List<UnitTemplate> values) {
        values.forEach(this::register);
        return this;
    }

    public Optional<UnitTemplate> get(String typePattern) {
        return Optional.ofNullable(templates.get(typePattern));
    }

    /**
     * First registered template whose pattern matches {@code type}.
     */
    public Optional<UnitTemplate> findByType(String type) {
        return templates.values().stream().filter(t -> t.matchesType(type)).findFirst();
    }

    public List<UnitTemplate> templates() {
        return List.copyOf(templates.values());
    }

    public Unit create(String typePattern, String id, String type, Map<String, Object> payload) {
        return create(typePattern, id, type, payload, null, null, null, ConsumptionMode.ONE_SHOT, true);
    }

    /**
     * Builds a unit from the template registered under {@code typePattern}, falling back to the
     * first template matching {@code type}. The unit is registered on the engine when
     * {@code autoRegister} is set.
     */
    public Unit create(
        String typePattern,
        String id,
        String type,
        Map<String, Object> payload,
        Guard guard,
        Map<String, Object> metadata,
        List<String> dependsOn,
        ConsumptionMode consumption,
        boolean autoRegister
    ) {
        var template = get(typePattern)
            .or(() -> findByType(type))
            .orElseThrow(() -> new TemplateViolationException(
                "Template not found for pattern '" + typePattern + "' or type '" + type
                    + "'. Available templates: " + templates.keySet()));
        var unit = template.create(id, type, payload, guard, metadata, dependsOn, consumption);
        if (autoRegister) {
            engine.register(unit);
        }
        return unit;
    }
}
