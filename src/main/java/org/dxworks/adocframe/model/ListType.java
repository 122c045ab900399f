package org.dxworks.adocframe.model;

public enum ListType {
    ORDERED,
    UNORDERED,
    DEFINITION
}
