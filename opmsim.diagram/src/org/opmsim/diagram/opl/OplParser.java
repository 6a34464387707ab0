package org.opmsim.diagram.opl;

import java.util.*;
import java.util.regex.Matcher;

import org.apache.log4j.Logger;
import org.opmsim.constants.EngineConstants;
import org.opmsim.diagram.graph.*;
import org.opmsim.diagram.model.*;

import static org.opmsim.diagram.opl.OplPatterns.*;

/**
 * Turns structured OPL sentences into diagram edits.
 *
 * Parsing never touches the graph: it resolves names against the current diagram, allocates
 * ids for everything new and returns a single {@link CompositeCommand}. Definitions are read
 * in a first pass so their attributes apply to nodes that later sentences create.
 */
public class OplParser {
    private static final Logger logger = Logger.getLogger(OplParser.class);

    private static final double PROCESS_ROW_Y = -150;
    private static final double OBJECT_ROW_Y = 130;
    private static final double COLUMN_SPACING = 200;
    private static final double MARGIN = 150;
    private static final double EMPTY_RIGHT_EDGE = 200;
    private static final double STATE_GAP = 4;

    private final DiagramGraph graph;
    private final IdAllocator allocator;

    public OplParser(DiagramGraph graph, IdAllocator allocator) {
        this.graph = graph;
        this.allocator = allocator;
    }

    public OplImportResult parse(String text) {
        return parse(text, null);
    }

    /**
     * @param viewProcessId zoom-in view that receives new nodes; null for the root view
     */
    public OplImportResult parse(String text, String viewProcessId) {
        Batch batch = new Batch(viewProcessId);
        String[] lines = text.split("\\r?\\n");

        for (String raw : lines) {
            String line = raw.trim();
            if (!line.isEmpty()) {
                batch.readDefinition(line);
            }
        }

        List<String> ignored = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || isDefinition(line)) {
                continue;
            }
            if (!batch.readSentence(line)) {
                ignored.add(line);
            }
        }

        OplImportResult result = batch.toResult(ignored);
        logger.info("OPL import: " + result.getCommand().getChildren().size() + " edit(s), "
                + ignored.size() + " ignored line(s), " + result.getSkippedLinks().size() + " skipped link(s)");
        return result;
    }

    static boolean isDefinition(String line) {
        if (DEFINITION.matcher(line).matches()) {
            return true;
        }
        Matcher m = DEFINITION_SINGLE.matcher(line);
        if (m.matches() && startsLowerCase(m.group("attr"))) {
            return true;
        }
        m = DEFINITION_MINIMAL.matcher(line);
        return m.matches() && startsLowerCase(m.group("attr"));
    }

    /**
     * Working view of the diagram while one text is parsed: existing nodes plus everything
     * the text creates.
     */
    private class Batch {
        private final String viewProcessId;
        private final Map<String, Node> byLabel = new HashMap<>();
        private final Map<String, Node> createdNodes = new LinkedHashMap<>();
        private final Map<String, Node> updatedNodes = new LinkedHashMap<>();
        private final Map<String, Node> createdStates = new LinkedHashMap<>();
        private final List<Link> createdLinks = new ArrayList<>();
        private final Set<String> linkKeys = new HashSet<>();
        private final List<String> skippedLinks = new ArrayList<>();
        private final double baseX;
        private int processColumn;
        private int objectColumn;

        Batch(String viewProcessId) {
            this.viewProcessId = viewProcessId;
            double rightEdge = Double.NEGATIVE_INFINITY;
            for (Node node : graph.nodes()) {
                if (node.isState()) {
                    continue;
                }
                if (!byLabel.containsKey(node.getLabel())) {
                    byLabel.put(node.getLabel(), node);
                }
                rightEdge = Math.max(rightEdge, node.getGeometry().getRight());
            }
            for (Link link : graph.links()) {
                linkKeys.add(key(link.getKind(), link.getSourceId(), link.getTargetId()));
            }
            this.baseX = (rightEdge == Double.NEGATIVE_INFINITY ? EMPTY_RIGHT_EDGE : rightEdge) + MARGIN;
        }

        // === first pass ===

        void readDefinition(String line) {
            Matcher m = DEFINITION.matcher(line);
            if (m.matches()) {
                boolean essenceFirst = m.group("essence1") != null;
                Essence essence = Essence.fromWireName(essenceFirst ? m.group("essence1") : m.group("essence2"));
                Affiliation affiliation = Affiliation.fromWireName(
                        essenceFirst ? m.group("affiliation1") : m.group("affiliation2"));
                define(norm(m.group("name")), NodeKind.fromWireName(m.group("kind")), essence, affiliation);
                return;
            }
            m = DEFINITION_SINGLE.matcher(line);
            if (m.matches() && startsLowerCase(m.group("attr"))) {
                NodeKind kind = NodeKind.fromWireName(m.group("kind"));
                defineSingle(norm(m.group("name")), kind, m.group("attr"));
                return;
            }
            m = DEFINITION_MINIMAL.matcher(line);
            if (m.matches() && startsLowerCase(m.group("attr"))) {
                defineSingle(norm(m.group("name")), NodeKind.OBJECT, m.group("attr"));
            }
        }

        private void defineSingle(String name, NodeKind kind, String attr) {
            Essence essence = Essence.fromWireName(attr);
            Affiliation affiliation = Affiliation.fromWireName(attr);
            if (essence == null) {
                essence = defaultEssence(kind);
            }
            if (affiliation == null) {
                affiliation = Affiliation.SYSTEMIC;
            }
            define(name, kind, essence, affiliation);
        }

        private void define(String name, NodeKind kind, Essence essence, Affiliation affiliation) {
            Node existing = byLabel.get(name);
            if (existing == null) {
                Node created = create(kind, name).withEssence(essence).withAffiliation(affiliation);
                createdNodes.put(created.getId(), created);
                byLabel.put(name, created);
                return;
            }
            Node updated = existing.withEssence(essence).withAffiliation(affiliation);
            if (createdNodes.containsKey(existing.getId())) {
                createdNodes.put(existing.getId(), updated);
            } else if (!updated.equals(existing) || updatedNodes.containsKey(existing.getId())) {
                updatedNodes.put(existing.getId(), updated);
            }
            byLabel.put(name, updated);
        }

        // === second pass ===

        boolean readSentence(String line) {
            Matcher m = CONSUMES.matcher(line);
            if (m.matches()) {
                Node process = process(m.group("p"));
                Node object = object(m.group("obj"));
                link(stateOrObject(object, m.group("state")), process, LinkKind.CONSUMPTION);
                return true;
            }
            m = INPUTS.matcher(line);
            if (m.matches()) {
                Node process = process(m.group("p"));
                for (String name : splitNames(m.group("objs"))) {
                    link(object(name), process, LinkKind.CONSUMPTION);
                }
                return true;
            }
            m = YIELDS.matcher(line);
            if (m.matches()) {
                Node process = process(m.group("p"));
                Node object = object(m.group("obj"));
                link(process, stateOrObject(object, m.group("state")), LinkKind.RESULT);
                return true;
            }
            m = HANDLES.matcher(line);
            if (m.matches()) {
                Node process = process(m.group("p"));
                for (String name : splitNames(m.group("agents"))) {
                    link(object(name), process, LinkKind.AGENT);
                }
                return true;
            }
            m = REQUIRES.matcher(line);
            if (m.matches()) {
                Node process = process(m.group("p"));
                for (String name : splitNames(m.group("objs"))) {
                    link(object(name), process, LinkKind.INSTRUMENT);
                }
                return true;
            }
            m = AFFECTS.matcher(line);
            if (m.matches()) {
                String x = norm(m.group("x"));
                String y = norm(m.group("y"));
                if (kindOf(x) == NodeKind.OBJECT || kindOf(y) == NodeKind.PROCESS) {
                    link(object(x), process(y), LinkKind.EFFECT);
                } else {
                    link(process(x), object(y), LinkKind.EFFECT);
                }
                return true;
            }
            m = CHANGES.matcher(line);
            if (m.matches()) {
                Node process = process(m.group("p"));
                Node object = object(m.group("obj"));
                link(state(object, norm(m.group("from"))), process, LinkKind.CONSUMPTION);
                link(process, state(object, norm(m.group("to"))), LinkKind.RESULT);
                return true;
            }
            m = CONSISTS_OF.matcher(line);
            if (m.matches()) {
                Node whole = object(m.group("whole"));
                for (String part : splitNames(m.group("parts"))) {
                    link(object(part), whole, LinkKind.AGGREGATION);
                }
                return true;
            }
            m = CHARACTERIZED_BY.matcher(line);
            if (m.matches()) {
                structural(m.group("obj"), m.group("attrs"), LinkKind.EXHIBITION);
                return true;
            }
            m = EXHIBITS.matcher(line);
            if (m.matches()) {
                structural(m.group("obj"), m.group("attrs"), LinkKind.EXHIBITION);
                return true;
            }
            m = GENERALIZES.matcher(line);
            if (m.matches()) {
                structural(m.group("general"), m.group("subs"), LinkKind.GENERALIZATION);
                return true;
            }
            m = INSTANCE_OF.matcher(line);
            if (m.matches()) {
                structural(m.group("cls"), m.group("inst"), LinkKind.INSTANTIATION);
                return true;
            }
            m = ARE.matcher(line);
            if (m.matches()) {
                structural(m.group("general"), m.group("subs"), LinkKind.GENERALIZATION);
                return true;
            }
            m = HAS_INSTANCES.matcher(line);
            if (m.matches()) {
                structural(m.group("cls"), m.group("insts"), LinkKind.INSTANTIATION);
                return true;
            }
            m = CAN_BE.matcher(line);
            if (m.matches()) {
                Node object = object(m.group("obj"));
                for (String label : splitStates(m.group("states"))) {
                    state(object, label);
                }
                return true;
            }
            m = IS_STATE.matcher(line);
            if (m.matches() && startsLowerCase(m.group("state")) && !isAttributeWord(m.group("state"))) {
                state(object(m.group("obj")), m.group("state"));
                return true;
            }
            m = IS_A.matcher(line);
            if (m.matches() && startsUpperCase(norm(m.group("general")))) {
                link(object(m.group("sub")), object(m.group("general")), LinkKind.GENERALIZATION);
                return true;
            }
            m = NAME.matcher(line);
            if (m.matches()) {
                object(m.group("name"));
                return true;
            }
            return false;
        }

        /** Structural links point from each refinement to the refined thing. */
        private void structural(String refinedName, String refinementNames, LinkKind kind) {
            Node refined = object(refinedName);
            for (String name : splitNames(refinementNames)) {
                link(object(name), refined, kind);
            }
        }

        // === name resolution ===

        private NodeKind kindOf(String name) {
            Node node = byLabel.get(name);
            return node == null ? null : node.getKind();
        }

        /** Existing node with this label, whatever its kind, or a new process. */
        private Node process(String rawName) {
            return resolve(norm(rawName), NodeKind.PROCESS);
        }

        /** Existing node with this label, whatever its kind, or a new object. */
        private Node object(String rawName) {
            return resolve(norm(rawName), NodeKind.OBJECT);
        }

        private Node resolve(String name, NodeKind kindIfNew) {
            Node existing = byLabel.get(name);
            if (existing != null) {
                return existing;
            }
            Node created = create(kindIfNew, name)
                    .withEssence(defaultEssence(kindIfNew))
                    .withAffiliation(Affiliation.SYSTEMIC);
            createdNodes.put(created.getId(), created);
            byLabel.put(name, created);
            return created;
        }

        private Node create(NodeKind kind, String name) {
            double centerX;
            double centerY;
            if (kind == NodeKind.PROCESS) {
                centerX = baseX + processColumn++ * COLUMN_SPACING;
                centerY = PROCESS_ROW_Y;
            } else {
                centerX = baseX + objectColumn++ * COLUMN_SPACING;
                centerY = OBJECT_ROW_Y;
            }
            double w = EngineConstants.NODE_WIDTH;
            double h = EngineConstants.NODE_HEIGHT;
            Geometry geometry = new Geometry(snap(centerX) - w / 2, snap(centerY) - h / 2, w, h);
            return Node.of(kind, allocator.next(kind), name, geometry, viewProcessId);
        }

        private Node stateOrObject(Node object, String stateName) {
            return stateName == null ? object : state(object, norm(stateName));
        }

        /**
         * State with this label of the object, created when missing. Returns null when the
         * named thing is not an object.
         */
        private Node state(Node object, String label) {
            if (!object.isObject()) {
                skippedLinks.add("'" + object.getLabel() + "' is a " + object.getKind().getWireName()
                        + " and cannot have state '" + label + "'");
                return null;
            }
            int count = 0;
            for (Node state : graph.statesOf(object.getId())) {
                if (state.getLabel().equals(label)) {
                    return state;
                }
                count++;
            }
            for (Node state : createdStates.values()) {
                if (state.getParentObjectId().equals(object.getId())) {
                    if (state.getLabel().equals(label)) {
                        return state;
                    }
                    count++;
                }
            }
            Geometry parent = object.getGeometry();
            double x = (parent.getWidth() - EngineConstants.STATE_WIDTH) / 2;
            double y = STATE_GAP + count * (EngineConstants.STATE_HEIGHT + STATE_GAP);
            Node state = Node.state(allocator.next(IdKind.STATE), label,
                    new Geometry(x, y, EngineConstants.STATE_WIDTH, EngineConstants.STATE_HEIGHT),
                    object.getId(), object.getOwningProcessId(), false);
            createdStates.put(state.getId(), state);
            return state;
        }

        private void link(Node source, Node target, LinkKind kind) {
            if (source == null || target == null) {
                return;
            }
            String key = key(kind, source.getId(), target.getId());
            if (linkKeys.contains(key)) {
                skippedLinks.add("Link already exists: " + source.getLabel() + " -" + kind.getWireName()
                        + "-> " + target.getLabel());
                return;
            }
            if (!kind.allows(source.getKind(), target.getKind())) {
                skippedLinks.add("Link ignored: " + kind.getWireName() + " cannot connect "
                        + source.getKind().getWireName() + " '" + source.getLabel() + "' to "
                        + target.getKind().getWireName() + " '" + target.getLabel() + "' (expected "
                        + kind.describeEndpoints() + ")");
                return;
            }
            linkKeys.add(key);
            createdLinks.add(new Link(allocator.next(IdKind.LINK), kind, source.getId(), target.getId()));
        }

        OplImportResult toResult(List<String> ignored) {
            List<DiagramCommand> steps = new ArrayList<>();
            for (Node node : createdNodes.values()) {
                steps.add(new AddNodeCommand(graph, node));
            }
            for (Node node : updatedNodes.values()) {
                steps.add(new ChangeAttributesCommand(graph, node.getId(), node.getEssence(),
                        node.getAffiliation(), null));
            }
            for (Node state : createdStates.values()) {
                steps.add(new AddNodeCommand(graph, state));
            }
            for (Link link : createdLinks) {
                steps.add(new AddLinkCommand(graph, link));
            }
            for (String message : skippedLinks) {
                logger.warn(message);
            }
            CompositeCommand command = new CompositeCommand("Import OPL (" + steps.size() + " edits)", steps);
            return new OplImportResult(command, ignored, skippedLinks);
        }
    }

    private static String key(LinkKind kind, String sourceId, String targetId) {
        return kind.name() + "|" + sourceId + "|" + targetId;
    }

    private static Essence defaultEssence(NodeKind kind) {
        return kind == NodeKind.PROCESS ? Essence.PHYSICAL : Essence.INFORMATICAL;
    }

    private static double snap(double value) {
        return Math.round(value / EngineConstants.GRID_SIZE) * (double) EngineConstants.GRID_SIZE;
    }
}
