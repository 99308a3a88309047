package work.bindlang.orchestration;

import java.time.LocalDateTime;

/**
 * One perspective in an actor sequence.
 *
 * @param actor     acting perspective, {@code null} for the system perspective
 * @param location  where the turn happens; {@code null} is treated as empty
 * @param timestamp evaluation time; {@code null} falls back to the sequence start time
 */
public record ActorTurn(String actor, String location, LocalDateTime timestamp) {
    public ActorTurn {
        location = location == null ? "" : location;
    }

    public static ActorTurn of(String actor, String location) {
        return new ActorTurn(actor, location, null);
    }

    public static ActorTurn system(String location) {
        return new ActorTurn(null, location, null);
    }

    public static ActorTurn at(LocalDateTime timestamp, String actor, String location) {
        return new ActorTurn(actor, location, timestamp);
    }
}
