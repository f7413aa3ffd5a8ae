package com.conveyor.engine.model;

/**
 * Target OS and CPU architecture of a pipeline, e.g. linux/arm64.
 * Missing parts default to linux/amd64.
 */
public record Platform(String os, String arch) {

    public static final Platform DEFAULT = new Platform("linux", "amd64");

    public Platform {
        if (os == null || os.isBlank())     os = "linux";
        if (arch == null || arch.isBlank()) arch = "amd64";
    }

    /** Parse "os/arch"; a bare value is taken as the OS. */
    public static Platform parse(String value) {
        if (value == null || value.isBlank()) return DEFAULT;
        int slash = value.indexOf('/');
        if (slash < 0) return new Platform(value.strip(), null);
        return new Platform(value.substring(0, slash).strip(), value.substring(slash + 1).strip());
    }

    @Override
    public String toString() {
        return os + "/" + arch;
    }
}
