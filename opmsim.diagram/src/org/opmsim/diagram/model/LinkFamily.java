package org.opmsim.diagram.model;

public enum LinkFamily {
    STRUCTURAL,
    PROCEDURAL
}
