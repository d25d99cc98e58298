package ai.vmhost.virtualizer.model;

import java.util.Arrays;

/**
 * Persisted virtualizer definition: backend type plus its opaque configuration.
 */
public record CatalogEntry(
    String name,
    String type,
    byte[] data
) {
    @Override
    public boolean equals(Object o) {
        return o instanceof CatalogEntry other && name.equals(other.name) && type.equals(other.type)
            && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + type.hashCode()) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "CatalogEntry{name='" + name + "', type='" + type + "', data=" + data.length + " bytes}";
    }
}
