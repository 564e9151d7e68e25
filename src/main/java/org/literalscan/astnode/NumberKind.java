package org.literalscan.astnode;

public enum NumberKind {
    INTEGER,
    FLOAT
}
