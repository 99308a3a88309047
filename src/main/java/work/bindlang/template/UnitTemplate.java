package work.bindlang.template;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import work.bindlang.model.ConsumptionMode;
import work.bindlang.model.Guard;
import work.bindlang.model.Unit;

/**
 * Reusable shape for units of a type family, e.g. {@code "ACTION:*"}.
 * <p>
 * Guard requirements map a guard field ({@code actors}, {@code temporal}, {@code locations},
 * {@code state}) to {@code "required"}; such fields must be present on the effective guard.
 */
public final class UnitTemplate {
    private static final Set<String> GUARD_FIELDS = Set.of("actors", "temporal", "locations", "state");

    private final String typePattern;
    private final Pattern compiledPattern;
    private final Set<String> requiredFields;
    private final Set<String> optionalFields;
    private final Map<String, Object> guardRequirements;
    private final Guard defaultGuard;
    private final PayloadValidator validator;

    private UnitTemplate(Builder builder) {
        if (builder.typePattern == null || builder.typePattern.isBlank()) {
            throw new TemplateViolationException("typePattern is required");
        }
        if (!builder.typePattern.contains("*")) {
            throw new TemplateViolationException("typePattern must contain '*' wildcard");
        }
        for (String field : builder.guardRequirements.keySet()) {
            if (!GUARD_FIELDS.contains(field)) {
                throw new TemplateViolationException("Unknown guard field in requirements: '" + field + "'");
            }
        }
        this.typePattern = builder.typePattern;
        this.compiledPattern = compile(builder.typePattern);
        this.requiredFields = Set.copyOf(builder.requiredFields);
        this.optionalFields = Set.copyOf(builder.optionalFields);
        this.guardRequirements = Map.copyOf(builder.guardRequirements);
        this.defaultGuard = builder.defaultGuard;
        this.validator = builder.validator;
    }

    public static Builder builder(String typePattern) {
        return new Builder(typePattern);
    }

    public String typePattern() {
        return typePattern;
    }

    public Set<String> requiredFields() {
        return requiredFields;
    }

    public Set<String> optionalFields() {
        return optionalFields;
    }

    public Guard defaultGuard() {
        return defaultGuard;
    }

    public boolean matchesType(String type) {
        return type != null && compiledPattern.matcher(type).matches();
    }

    public Unit create(String id, String type, Map<String, Object> payload) {
        return create(id, type, payload, null, null, null, ConsumptionMode.ONE_SHOT);
    }

    /**
     * Validates the inputs against this template and builds the unit. {@code guard} falls back
     * to the template's default guard.
     */
    public Unit create(
        String id,
        String type,
        Map<String, Object> payload,
        Guard guard,
        Map<String, Object> metadata,
        List<String> dependsOn,
        ConsumptionMode consumption
    ) {
        if (!matchesType(type)) {
            throw new TemplateViolationException(
                "Unit type '" + type + "' doesn't match template pattern '" + typePattern + "'");
        }
        Map<String, Object> safePayload = payload == null ? Map.of() : payload;
        var missing = new TreeSet<>(requiredFields);
        missing.removeAll(safePayload.keySet());
        if (!missing.isEmpty()) {
            throw new TemplateViolationException("Missing required payload fields: " + String.join(", ", missing));
        }
        Guard effective = guard != null ? guard : defaultGuard;
        if (effective == null) {
            throw new TemplateViolationException("No guard provided and no default guard in template");
        }
        checkGuardRequirements(effective);
        validator.validate(safePayload);
        return new Unit(id, type, effective, safePayload, metadata, dependsOn, consumption);
    }

    /**
     * Descriptive summary for tooling and prompt construction.
     */
    public Map<String, Object> toSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("typePattern", typePattern);
        schema.put("requiredPayloadFields", List.copyOf(new TreeSet<>(requiredFields)));
        schema.put("optionalPayloadFields", List.copyOf(new TreeSet<>(optionalFields)));
        schema.put("guardRequirements", new LinkedHashMap<>(guardRequirements));
        return schema;
    }

    private void checkGuardRequirements(Guard guard) {
        for (var entry : guardRequirements.entrySet()) {
            if (!"required".equals(String.valueOf(entry.getValue()))) continue;
            boolean present = switch (entry.getKey()) {
                case "actors" -> guard.hasActors();
                case "temporal" -> guard.hasTemporal();
                case "locations" -> guard.hasLocations();
                case "state" -> guard.hasState();
                default -> true;
            };
            if (!present) {
                throw new TemplateViolationException("Template '" + typePattern + "' requires guard field '" + entry.getKey() + "'");
            }
        }
    }

    private static Pattern compile(String wildcard) {
        var regex = new StringBuilder("^");
        for (String part : wildcard.split("\\*", -1)) {
            if (regex.length() > 1) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(part));
        }
        return Pattern.compile(regex.append("$").toString());
    }

    public static final class Builder {
        private final String typePattern;
        private final Set<String> requiredFields = new LinkedHashSet<>();
        private final Set<String> optionalFields = new LinkedHashSet<>();
        private final Map<String, Object> guardRequirements = new LinkedHashMap<>();
        private Guard defaultGuard;
        private PayloadValidator validator = PayloadValidator.NONE;

        private Builder(String typePattern) {
            this.typePattern = typePattern;
        }

        public Builder required(Collection<String> fields) {
            requiredFields.addAll(fields);
            return this;
        }

        public Builder required(String... fields) {
            return required(List.of(fields));
        }

        public Builder optional(Collection<String> fields) {
            optionalFields.addAll(fields);
            return this;
        }

        public Builder optional(String... fields) {
            return optional(List.of(fields));
        }

        public Builder guardRequirement(String field, Object requirement) {
            guardRequirements.put(field, requirement);
            return this;
        }

        public Builder defaultGuard(Guard guard) {
            this.defaultGuard = guard;
            return this;
        }

        public Builder validator(PayloadValidator validator) {
            this.validator = validator == null ? PayloadValidator.NONE : validator;
            return this;
        }

        public UnitTemplate build() {
            return new UnitTemplate(this);
        }
    }
}
