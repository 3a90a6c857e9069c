package wikisearch.services;

public enum SearchBackendType {
    ENGINE,
    FALLBACK
}
