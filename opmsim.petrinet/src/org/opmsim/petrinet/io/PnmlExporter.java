package org.opmsim.petrinet.io;

import java.awt.geom.Point2D;
import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.apache.log4j.Logger;
import org.opmsim.diagram.graph.DiagramGraph;
import org.opmsim.diagram.model.Geometry;
import org.opmsim.diagram.model.Node;
import org.opmsim.petrinet.model.*;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Writes a derived net as a PNML place/transition net document.
 *
 * PNML has no test arcs, so a test arc is written as an input arc plus an output arc of the
 * same weight, which has the same firing effect.
 */
public final class PnmlExporter {
    private static final Logger logger = Logger.getLogger(PnmlExporter.class);

    public static final String NS = "http://www.pnml.org/version-2009/grammar/pnml";
    private static final double VARIANT_SPACING = 40;

    private PnmlExporter() {
    }

    public static void write(PetriNet net, Marking marking, Map<String, Point2D> positions, File out)
            throws IOException {
        try (OutputStream stream = new BufferedOutputStream(new FileOutputStream(out))) {
            write(net, marking, positions, stream);
        }
    }

    public static void write(PetriNet net, Marking marking, Map<String, Point2D> positions, Writer out)
            throws IOException {
        transform(buildDocument(net, marking, positions), new StreamResult(out));
    }

    /**
     * @param marking tokens written as each place's initial marking
     * @param positions optional coordinates by place or transition id; may be empty
     */
    public static void write(PetriNet net, Marking marking, Map<String, Point2D> positions, OutputStream out)
            throws IOException {
        transform(buildDocument(net, marking, positions), new StreamResult(out));
    }

    public static String toXml(PetriNet net, Marking marking, Map<String, Point2D> positions) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        write(net, marking, positions, buffer);
        return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    }

    /**
     * Positions for every place and transition taken from the diagram node centres. State
     * places sit at the state's absolute centre. Further transitions of the same process are
     * stacked below the first.
     */
    public static Map<String, Point2D> layoutFrom(DiagramGraph graph, PetriNet net) {
        Map<String, Point2D> positions = new LinkedHashMap<>();
        for (Place place : net.getPlaces()) {
            String nodeId = place.getStateId() != null ? place.getStateId() : place.getObjectId();
            Point2D centre = absoluteCentre(graph, nodeId);
            if (centre != null) {
                positions.put(place.getId(), centre);
            }
        }
        Map<String, Integer> perProcess = new HashMap<>();
        for (Transition transition : net.getTransitions()) {
            Point2D centre = absoluteCentre(graph, transition.getProcessId());
            if (centre != null) {
                int index = perProcess.merge(transition.getProcessId(), 1, Integer::sum) - 1;
                positions.put(transition.getId(), new Point2D.Double(centre.getX(), centre.getY() + index * VARIANT_SPACING));
            }
        }
        return positions;
    }

    private static Point2D absoluteCentre(DiagramGraph graph, String nodeId) {
        Node node = nodeId == null ? null : graph.findNode(nodeId);
        if (node == null) {
            return null;
        }
        Geometry g = node.getGeometry();
        double x = g.getX() + g.getWidth() / 2;
        double y = g.getY() + g.getHeight() / 2;
        if (node.isState()) {
            Node parent = graph.findNode(node.getParentObjectId());
            if (parent != null) {
                x += parent.getGeometry().getX();
                y += parent.getGeometry().getY();
            }
        }
        return new Point2D.Double(x, y);
    }

    // === DOCUMENT ===

    private static Document buildDocument(PetriNet net, Marking marking, Map<String, Point2D> positions)
            throws IOException {
        Document doc;
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            DocumentBuilder db = dbf.newDocumentBuilder();
            doc = db.newDocument();
        } catch (ParserConfigurationException e) {
            throw new IOException("Cannot create XML document", e);
        }

        Element pnml = doc.createElementNS(NS, "pnml");
        doc.appendChild(pnml);
        Element netElement = doc.createElementNS(NS, "net");
        netElement.setAttribute("id", "opm-net");
        netElement.setAttribute("type", "http://www.pnml.org/version-2009/grammar/ptnet");
        pnml.appendChild(netElement);
        Element page = doc.createElementNS(NS, "page");
        page.setAttribute("id", "page1");
        netElement.appendChild(page);

        for (Place place : net.getPlaces()) {
            Element el = doc.createElementNS(NS, "place");
            el.setAttribute("id", place.getId());
            el.appendChild(textElement(doc, "name", place.getLabel()));
            int tokens = marking.get(place.getId());
            if (tokens > 0) {
                el.appendChild(textElement(doc, "initialMarking", Integer.toString(tokens)));
            }
            appendPosition(doc, el, positions.get(place.getId()));
            page.appendChild(el);
        }

        for (Transition transition : net.getTransitions()) {
            Element el = doc.createElementNS(NS, "transition");
            el.setAttribute("id", transition.getId());
            el.appendChild(textElement(doc, "name", transition.getLabel()));
            appendPosition(doc, el, positions.get(transition.getId()));
            page.appendChild(el);
        }

        int arcCount = 0;
        for (Arc arc : net.getArcs()) {
            switch (arc.getType()) {
                case INPUT:
                    page.appendChild(arcElement(doc, ++arcCount, arc.getPlaceId(), arc.getTransitionId(), arc.getWeight()));
                    break;
                case OUTPUT:
                    page.appendChild(arcElement(doc, ++arcCount, arc.getTransitionId(), arc.getPlaceId(), arc.getWeight()));
                    break;
                case TEST:
                    page.appendChild(arcElement(doc, ++arcCount, arc.getPlaceId(), arc.getTransitionId(), arc.getWeight()));
                    page.appendChild(arcElement(doc, ++arcCount, arc.getTransitionId(), arc.getPlaceId(), arc.getWeight()));
                    break;
                default:
                    throw new IllegalStateException("Unhandled arc type " + arc.getType());
            }
        }
        logger.debug("PNML document built for " + net + " with " + arcCount + " arcs");
        return doc;
    }

    private static Element arcElement(Document doc, int number, String source, String target, int weight) {
        Element el = doc.createElementNS(NS, "arc");
        el.setAttribute("id", "arc_" + number);
        el.setAttribute("source", source);
        el.setAttribute("target", target);
        el.appendChild(textElement(doc, "inscription", Integer.toString(weight)));
        return el;
    }

    private static Element textElement(Document doc, String name, String value) {
        Element el = doc.createElementNS(NS, name);
        Element text = doc.createElementNS(NS, "text");
        text.setTextContent(value);
        el.appendChild(text);
        return el;
    }

    private static void appendPosition(Document doc, Element el, Point2D position) {
        if (position == null) {
            return;
        }
        Element graphics = doc.createElementNS(NS, "graphics");
        Element pos = doc.createElementNS(NS, "position");
        pos.setAttribute("x", Double.toString(position.getX()));
        pos.setAttribute("y", Double.toString(position.getY()));
        graphics.appendChild(pos);
        el.appendChild(graphics);
    }

    private static void transform(Document doc, StreamResult result) throws IOException {
        try {
            TransformerFactory tf = TransformerFactory.newInstance();
            Transformer tr = tf.newTransformer();
            tr.setOutputProperty(OutputKeys.INDENT, "yes");
            tr.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            tr.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            tr.transform(new DOMSource(doc), result);
        } catch (TransformerException e) {
            throw new IOException("Cannot write PNML document", e);
        }
    }
}
