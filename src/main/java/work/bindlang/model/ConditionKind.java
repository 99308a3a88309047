package work.bindlang.model;

/**
 * Guard condition that produced a {@link FailureReason}.
 */
public enum ConditionKind {
    ACTOR("actor"),
    TEMPORAL("temporal"),
    LOCATION("location"),
    STATE("state"),
    DEPENDENCY("dependency"),
    EXPIRED("expired");

    private final String wireName;

    ConditionKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
