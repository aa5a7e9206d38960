package no.ssb.dapla.pathfinder.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import no.ssb.dapla.pathfinder.model.Point;

import java.util.Objects;

/**
 * A point identified by a string, with a display name.
 */
public class NamedPoint implements Point<String> {

    private final String id;
    private final String name;

    @JsonCreator
    public NamedPoint(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name
    ) {
        this.id = Objects.requireNonNull(id);
        this.name = name == null ? id : name;
    }

    public static NamedPoint of(String id) {
        return new NamedPoint(id, id);
    }

    @Override
    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NamedPoint that = (NamedPoint) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "NamedPoint{id='" + id + "', name='" + name + "'}";
    }
}
