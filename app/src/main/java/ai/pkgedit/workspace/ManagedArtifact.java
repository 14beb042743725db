package ai.pkgedit.workspace;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Objects;

/** A binary artifact that a package's binary target resolved to, and where it was placed on disk. */
public record ManagedArtifact(String packageRef, String targetName, Source source, String path) {

    public ManagedArtifact {
        Objects.requireNonNull(packageRef);
        Objects.requireNonNull(targetName);
        Objects.requireNonNull(source);
        Objects.requireNonNull(path);
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Source.Local.class, name = "local"),
        @JsonSubTypes.Type(value = Source.Remote.class, name = "remote")
    })
    public sealed interface Source {
        record Local() implements Source {}

        record Remote(String url, String checksum) implements Source {
            public Remote {
                Objects.requireNonNull(url);
                Objects.requireNonNull(checksum);
            }
        }
    }
}
