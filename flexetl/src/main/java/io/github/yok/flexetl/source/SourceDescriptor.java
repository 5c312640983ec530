package io.github.yok.flexetl.source;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * Describes where a dataset comes from.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SourceDescriptor {

    // Kind of source
    SourceKind kind;

    // File path for CSV/JSON, URL for API
    String location;

    public SourceDescriptor(SourceKind kind, String location) {
        Preconditions.checkNotNull(kind, "kind must not be null");
        Preconditions.checkArgument(location != null && !location.isBlank(),
                "location must not be blank");
        this.kind = kind;
        this.location = location.trim();
    }

    /**
     * Creates a descriptor whose kind is detected from the location.
     *
     * @param location file path or URL
     * @return descriptor
     * @throws IllegalArgumentException if the kind cannot be detected
     */
    public static SourceDescriptor of(String location) {
        return new SourceDescriptor(SourceKind.detect(location), location);
    }
}
