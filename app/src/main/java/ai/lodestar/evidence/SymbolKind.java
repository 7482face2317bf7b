package ai.lodestar.evidence;

public enum SymbolKind {
    DEFINITION,
    REFERENCE
}
