package com.example.mediaindexer.domain.enumtype;

public enum FileChangeKind {
    CREATE,
    MODIFY,
    DELETE,
    MOVE,
    OVERFLOW
}
