package org.dxworks.adocframe.model;

public enum MacroType {
    BLOCK,
    INLINE
}
