package org.opmsim.diagram.graph;

public interface DiagramChangeListener {

    void diagramChanged(DiagramChange change);
}
