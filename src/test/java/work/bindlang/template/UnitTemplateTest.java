package work.bindlang.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.bindlang.model.ConsumptionMode;
import work.bindlang.model.Guard;

class UnitTemplateTest {
    private final Guard playerOnly = Guard.builder().actors("player").build();

    private UnitTemplate actionTemplate() {
        return UnitTemplate.builder("ACTION:*")
            .required("action")
            .optional("weight")
            .guardRequirement("actors", "required")
            .defaultGuard(playerOnly)
            .build();
    }

    @Test
    void wildcardMatching() {
        var template = actionTemplate();
        assertTrue(template.matchesType("ACTION:open"));
        assertFalse(template.matchesType("EVENT:open"));
        assertTrue(UnitTemplate.builder("*:greet").build().matchesType("SOCIAL:greet"));
        assertFalse(UnitTemplate.builder("A.B:*").build().matchesType("AXB:x"));
    }

    @Test
    void createsUnitWithDefaultGuard() {
        var unit = actionTemplate().create("open_door", "ACTION:open", Map.of("action", "open"));
        assertSame(playerOnly, unit.guard());
        assertEquals("open", unit.payload().get("action"));
        assertEquals(ConsumptionMode.ONE_SHOT, unit.consumption());
    }

    @Test
    void explicitArgumentsOverrideDefaults() {
        var guard = Guard.builder().actors("npc").build();
        var unit = actionTemplate().create("wave", "ACTION:wave", Map.of("action", "wave"),
            guard, Map.of("source", "test"), List.of("open_door"), ConsumptionMode.REUSABLE);
        assertSame(guard, unit.guard());
        assertEquals(List.of("open_door"), unit.dependsOn());
        assertEquals("test", unit.metadata().get("source"));
        assertTrue(unit.isReusable());
    }

    @Test
    void rejectsWrongType() {
        var ex = assertThrows(TemplateViolationException.class,
            () -> actionTemplate().create("x", "EVENT:boom", Map.of("action", "x")));
        assertEquals("Unit type 'EVENT:boom' doesn't match template pattern 'ACTION:*'", ex.getMessage());
    }

    @Test
    void rejectsMissingRequiredFields() {
        var template = UnitTemplate.builder("ACTION:*").required("action", "target").defaultGuard(Guard.open()).build();
        var ex = assertThrows(TemplateViolationException.class, () -> template.create("x", "ACTION:hit", Map.of()));
        assertEquals("Missing required payload fields: action, target", ex.getMessage());
    }

    @Test
    void rejectsMissingGuard() {
        var template = UnitTemplate.builder("ACTION:*").build();
        var ex = assertThrows(TemplateViolationException.class, () -> template.create("x", "ACTION:hit", Map.of()));
        assertEquals("No guard provided and no default guard in template", ex.getMessage());
    }

    @Test
    void enforcesGuardRequirements() {
        var ex = assertThrows(TemplateViolationException.class, () -> actionTemplate().create(
            "x", "ACTION:hit", Map.of("action", "hit"), Guard.open(), null, null, null));
        assertEquals("Template 'ACTION:*' requires guard field 'actors'", ex.getMessage());
    }

    @Test
    void customValidatorRuns() {
        var template = UnitTemplate.builder("ACTION:*")
            .defaultGuard(Guard.open())
            .validator(payload -> {
                if (!(payload.get("weight") instanceof Number)) {
                    throw new TemplateViolationException("weight must be numeric");
                }
            })
            .build();
        assertThrows(TemplateViolationException.class, () -> template.create("x", "ACTION:hit", Map.of("weight", "heavy")));
        assertEquals(2, template.create("x", "ACTION:hit", Map.of("weight", 2)).payload().get("weight"));
    }

    @Test
    void invalidTemplatesAreRejected() {
        assertThrows(TemplateViolationException.class, () -> UnitTemplate.builder("ACTION:open").build());
        assertThrows(TemplateViolationException.class,
            () -> UnitTemplate.builder("ACTION:*").guardRequirement("mood", "required").build());
    }

    @Test
    void schemaDescribesTemplate() {
        var schema = actionTemplate().toSchema();
        assertEquals("ACTION:*", schema.get("typePattern"));
        assertEquals(List.of("action"), schema.get("requiredPayloadFields"));
        assertEquals(List.of("weight"), schema.get("optionalPayloadFields"));
        assertEquals(Map.of("actors", "required"), schema.get("guardRequirements"));
    }
}
