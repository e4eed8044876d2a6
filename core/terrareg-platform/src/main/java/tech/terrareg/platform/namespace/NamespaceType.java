package tech.terrareg.platform.namespace;

public enum NamespaceType {
    USER,
    ORGANISATION
}
