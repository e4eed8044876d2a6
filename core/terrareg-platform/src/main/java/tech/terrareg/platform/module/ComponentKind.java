package tech.terrareg.platform.module;

/**
 * Kinds of version-owned directories.
 */
public enum ComponentKind {
    SUBMODULE,
    EXAMPLE
}
