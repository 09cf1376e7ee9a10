package net.labsched.core.model;

/** A host label. Versioned labels carry a value after the first ':' (e.g. cros-version:R80-12739.0.0). */
public record Label(Long id, String name) {
    public String baseName() {
        int i = name.indexOf(':');
        return i < 0 ? name : name.substring(0, i);
    }

    public String value() {
        int i = name.indexOf(':');
        return i < 0 ? null : name.substring(i + 1);
    }

    public boolean versioned() { return name.indexOf(':') >= 0; }
}
