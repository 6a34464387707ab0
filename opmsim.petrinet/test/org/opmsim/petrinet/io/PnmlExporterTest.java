package org.opmsim.petrinet.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.geom.Point2D;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import javax.xml.parsers.DocumentBuilderFactory;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opmsim.diagram.DiagramEditor;
import org.opmsim.diagram.model.Geometry;
import org.opmsim.diagram.model.LinkKind;
import org.opmsim.diagram.model.NodeKind;
import org.opmsim.petrinet.converter.ArcPolicy;
import org.opmsim.petrinet.converter.OpmToPetriNetConverter;
import org.opmsim.petrinet.model.*;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

class PnmlExporterTest {

    private static PetriNet printing() {
        return PetriNet.builder()
                .addPlace(new Place("place_object_1", "Paper", "object_1", null))
                .addPlace(new Place("place_object_2", "Printer", "object_2", null))
                .addPlace(new Place("place_object_3", "Page", "object_3", null))
                .addTransition(new Transition("transition_process_1", "Printing", "process_1"))
                .addArc("place_object_1", "transition_process_1", ArcType.INPUT, 2)
                .addArc("place_object_2", "transition_process_1", ArcType.TEST, 1)
                .addArc("place_object_3", "transition_process_1", ArcType.OUTPUT, 1)
                .setInitialTokens("place_object_1", 4)
                .setInitialTokens("place_object_2", 1)
                .build();
    }

    private static Document parse(String xml) throws Exception {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        return dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    private static Element byId(NodeList list, String id) {
        for (int i = 0; i < list.getLength(); i++) {
            Element el = (Element) list.item(i);
            if (id.equals(el.getAttribute("id"))) {
                return el;
            }
        }
        return null;
    }

    @Test
    void writesPlacesTransitionsAndArcs() throws Exception {
        PetriNet net = printing();
        Map<String, Point2D> positions = new HashMap<>();
        positions.put("place_object_1", new Point2D.Double(40, 60));

        Document doc = parse(PnmlExporter.toXml(net, net.getInitialMarking(), positions));

        assertEquals(1, doc.getElementsByTagNameNS(PnmlExporter.NS, "net").getLength());
        NodeList places = doc.getElementsByTagNameNS(PnmlExporter.NS, "place");
        assertEquals(3, places.getLength());
        assertEquals(1, doc.getElementsByTagNameNS(PnmlExporter.NS, "transition").getLength());

        Element paper = byId(places, "place_object_1");
        assertEquals("4", paper.getElementsByTagNameNS(PnmlExporter.NS, "initialMarking").item(0).getTextContent().trim());
        Element position = (Element) paper.getElementsByTagNameNS(PnmlExporter.NS, "position").item(0);
        assertEquals(40.0, Double.parseDouble(position.getAttribute("x")));
        assertEquals(60.0, Double.parseDouble(position.getAttribute("y")));

        Element page = byId(places, "place_object_3");
        assertEquals(0, page.getElementsByTagNameNS(PnmlExporter.NS, "initialMarking").getLength());
        assertEquals(0, page.getElementsByTagNameNS(PnmlExporter.NS, "graphics").getLength());
    }

    @Test
    void testArcBecomesReadAndWriteBackPair() throws Exception {
        PetriNet net = printing();
        Document doc = parse(PnmlExporter.toXml(net, net.getInitialMarking(), Collections.<String, Point2D>emptyMap()));

        NodeList arcs = doc.getElementsByTagNameNS(PnmlExporter.NS, "arc");
        assertEquals(4, arcs.getLength());
        int fromPrinter = 0;
        int toPrinter = 0;
        for (int i = 0; i < arcs.getLength(); i++) {
            Element arc = (Element) arcs.item(i);
            assertEquals("arc_" + (i + 1), arc.getAttribute("id"));
            if ("place_object_2".equals(arc.getAttribute("source"))) {
                fromPrinter++;
            }
            if ("place_object_2".equals(arc.getAttribute("target"))) {
                toPrinter++;
            }
        }
        assertEquals(1, fromPrinter);
        assertEquals(1, toPrinter);
    }

    @Test
    void exportUsesTheGivenMarking() throws Exception {
        PetriNet net = printing();
        Marking later = net.getInitialMarking().with("place_object_3", 2);
        Document doc = parse(PnmlExporter.toXml(net, later, Collections.<String, Point2D>emptyMap()));
        Element page = byId(doc.getElementsByTagNameNS(PnmlExporter.NS, "place"), "place_object_3");
        assertEquals("2", page.getElementsByTagNameNS(PnmlExporter.NS, "initialMarking").item(0).getTextContent().trim());
    }

    @Test
    void layoutFollowsDiagramCentres() throws Exception {
        DiagramEditor editor = new DiagramEditor();
        String book = editor.addNode(NodeKind.OBJECT, "Book", new Geometry(100, 50, 120, 60), null);
        String open = editor.addState(book, "Open", new Geometry(10, 20, 40, 20), true);
        String reading = editor.addNode(NodeKind.PROCESS, "Reading", new Geometry(300, 40, 100, 80), null);
        editor.addLink(LinkKind.EFFECT, book, reading);

        PetriNet net = new OpmToPetriNetConverter(ArcPolicy.TEST).convert(editor.getGraph());
        Map<String, Point2D> layout = PnmlExporter.layoutFrom(editor.getGraph(), net);

        assertEquals(new Point2D.Double(160, 80), layout.get(OpmToPetriNetConverter.placeId(book)));
        assertEquals(new Point2D.Double(130, 80), layout.get(OpmToPetriNetConverter.placeId(book, open)));
        assertEquals(new Point2D.Double(350, 80), layout.get(OpmToPetriNetConverter.transitionId(reading)));
    }

    @Test
    void writesToFile(@TempDir File dir) throws Exception {
        PetriNet net = printing();
        File out = new File(dir, "printing.pnml");
        PnmlExporter.write(net, net.getInitialMarking(), Collections.<String, Point2D>emptyMap(), out);
        assertTrue(out.length() > 0);
        Document doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(out);
        assertEquals("pnml", doc.getDocumentElement().getTagName());
    }
}
