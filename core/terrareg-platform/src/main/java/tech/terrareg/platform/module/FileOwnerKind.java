package tech.terrareg.platform.module;

public enum FileOwnerKind {
    MODULE_VERSION,
    EXAMPLE
}
