package org.opmsim.diagram.graph;

public enum CommandState {
    PENDING,
    APPLIED
}
