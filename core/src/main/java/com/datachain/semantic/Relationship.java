package com.datachain.semantic;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Directed relationship {@code incoming -> outgoing}.
 *
 * <p>The incoming table is the "one" side. Join keys are positional: the i-th
 * incoming key joins the i-th outgoing key.
 *
 * @param incoming the "one" side table
 * @param incomingKeys join key columns on the incoming table
 * @param type relationship cardinality
 * @param outgoing the "many" side table
 * @param outgoingKeys join key columns on the outgoing table
 */
public record Relationship(
        @JsonProperty("incoming") String incoming,
        @JsonProperty("incoming_keys") List<String> incomingKeys,
        @JsonProperty("type") RelationshipType type,
        @JsonProperty("outgoing") String outgoing,
        @JsonProperty("outgoing_keys") List<String> outgoingKeys) {

    public Relationship {
        Objects.requireNonNull(incoming, "incoming table must not be null");
        Objects.requireNonNull(outgoing, "outgoing table must not be null");
        incomingKeys = incomingKeys == null ? List.of() : List.copyOf(incomingKeys);
        outgoingKeys = outgoingKeys == null ? List.of() : List.copyOf(outgoingKeys);
        type = type == null ? RelationshipType.ONE_TO_MANY : type;
    }

    /**
     * Creates a one-to-many relationship joined on a single key pair.
     */
    public static Relationship oneToMany(String incoming, String incomingKey,
                                         String outgoing, String outgoingKey) {
        return new Relationship(incoming, List.of(incomingKey), RelationshipType.ONE_TO_MANY,
            outgoing, List.of(outgoingKey));
    }

    public TableEdge edge() {
        return new TableEdge(incoming, outgoing);
    }
}
