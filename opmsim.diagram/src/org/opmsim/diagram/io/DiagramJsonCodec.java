package org.opmsim.diagram.io;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.util.*;

import org.apache.log4j.Logger;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.opmsim.constants.EngineConstants;
import org.opmsim.diagram.graph.AddLinkCommand;
import org.opmsim.diagram.graph.AddNodeCommand;
import org.opmsim.diagram.graph.DiagramGraph;
import org.opmsim.diagram.model.*;
import org.opmsim.exceptions.CycleDetectedException;
import org.opmsim.exceptions.DiagramException;
import org.opmsim.exceptions.DiagramImportException;
import org.opmsim.validation.ValidationResult;

/**
 * Reads and writes the diagram exchange format:
 *
 * <pre>
 * { "nodes": [ {id, kind, label, x, y, w, h, essence, affiliation, parent_process_id,
 *               parent_object_id, initial} ],
 *   "links": [ {id, kind, source_id, target_id, label, card_src, card_dst} ],
 *   "meta":  { "format": "opm-mvp-json", "version": 1 } }
 * </pre>
 *
 * {@code x}/{@code y} are the centre of the node in diagram coordinates, states included;
 * in memory a state's geometry is kept relative to its object's top-left corner. Import keeps
 * going past bad records and reports each one.
 */
public class DiagramJsonCodec {
    private static final Logger logger = Logger.getLogger(DiagramJsonCodec.class);

    public static final String FORMAT = "opm-mvp-json";
    public static final int VERSION = 1;

    // Validation error types
    public static final String MALFORMED_DOCUMENT = "MALFORMED_DOCUMENT";
    public static final String MISSING_FIELD = "MISSING_FIELD";
    public static final String UNKNOWN_KIND = "UNKNOWN_KIND";
    public static final String BAD_VALUE = "BAD_VALUE";
    public static final String BAD_CARDINALITY = "BAD_CARDINALITY";

    // =============================================================================
    // EXPORT
    // =============================================================================

    @SuppressWarnings("unchecked")
    public JSONObject toJson(DiagramGraph graph) {
        JSONArray nodes = new JSONArray();
        for (Node node : graph.nodes()) {
            nodes.add(nodeToJson(graph, node));
        }
        JSONArray links = new JSONArray();
        for (Link link : graph.links()) {
            links.add(linkToJson(link));
        }
        JSONObject meta = new JSONObject();
        meta.put("format", FORMAT);
        meta.put("version", VERSION);

        JSONObject root = new JSONObject();
        root.put("nodes", nodes);
        root.put("links", links);
        root.put("meta", meta);
        return root;
    }

    public String write(DiagramGraph graph) {
        return toJson(graph).toJSONString();
    }

    public void write(DiagramGraph graph, Writer out) throws IOException {
        toJson(graph).writeJSONString(out);
        out.flush();
    }

    @SuppressWarnings("unchecked")
    private JSONObject nodeToJson(DiagramGraph graph, Node node) {
        Geometry g = node.getGeometry();
        if (node.isState()) {
            Node parent = graph.findNode(node.getParentObjectId());
            if (parent != null) {
                g = g.translate(parent.getGeometry().getX(), parent.getGeometry().getY());
            }
        }
        JSONObject json = new JSONObject();
        json.put("id", node.getId());
        json.put("kind", node.getKind().getWireName());
        json.put("label", node.getLabel());
        json.put("x", g.getX() + g.getWidth() / 2);
        json.put("y", g.getY() + g.getHeight() / 2);
        json.put("w", g.getWidth());
        json.put("h", g.getHeight());
        json.put("essence", node.getEssence().getWireName());
        json.put("affiliation", node.getAffiliation().getWireName());
        json.put("parent_process_id", node.getOwningProcessId());
        if (node.isState()) {
            json.put("parent_object_id", node.getParentObjectId());
            json.put("initial", node.isInitial());
        }
        return json;
    }

    @SuppressWarnings("unchecked")
    private JSONObject linkToJson(Link link) {
        JSONObject json = new JSONObject();
        json.put("id", link.getId());
        json.put("kind", link.getKind().getWireName());
        json.put("source_id", link.getSourceId());
        json.put("target_id", link.getTargetId());
        json.put("label", link.getLabel());
        json.put("card_src", link.getSourceCardinality() == null ? "" : link.getSourceCardinality().toString());
        json.put("card_dst", link.getTargetCardinality() == null ? "" : link.getTargetCardinality().toString());
        return json;
    }

    // =============================================================================
    // IMPORT
    // =============================================================================

    /**
     * Lenient import. Every rejected record is listed in the result's validation result.
     *
     * @throws DiagramImportException only when the text is not a JSON object at all
     */
    public DiagramImport read(String json) throws DiagramImportException {
        return read(new StringReader(json));
    }

    public DiagramImport read(Reader in) throws DiagramImportException {
        Object parsed;
        try {
            parsed = new JSONParser().parse(in);
        } catch (ParseException e) {
            throw new DiagramImportException("Diagram is not valid JSON: " + e, e);
        } catch (IOException e) {
            throw new DiagramImportException("Could not read diagram: " + e.getMessage(), e);
        }
        if (!(parsed instanceof JSONObject)) {
            ValidationResult result = new ValidationResult();
            result.addError(MALFORMED_DOCUMENT, "Top-level value must be an object", null, null);
            throw new DiagramImportException("Diagram document must be a JSON object", result);
        }
        return fromJson((JSONObject) parsed);
    }

    /**
     * Like {@link #read(String)}, but any rejected record fails the whole import.
     */
    public DiagramImport readStrict(String json) throws DiagramImportException {
        DiagramImport imported = read(json);
        ValidationResult result = imported.getValidationResult();
        if (result.hasErrors()) {
            throw new DiagramImportException(result.getErrorCount() + " record(s) rejected", result);
        }
        return imported;
    }

    public DiagramImport fromJson(JSONObject root) {
        ValidationResult result = new ValidationResult();
        DiagramGraph graph = new DiagramGraph();
        IdAllocator allocator = new IdAllocator();

        checkMeta(root.get("meta"), result);
        List<JSONObject> nodeRecords = records(root, "nodes", result);
        List<JSONObject> linkRecords = records(root, "links", result);

        // Reserve every id up front so generated ids never collide with imported ones
        for (JSONObject record : nodeRecords) {
            reserve(allocator, record.get("id"));
        }
        for (JSONObject record : linkRecords) {
            reserve(allocator, record.get("id"));
        }

        List<Node> processes = new ArrayList<>();
        List<Node> objects = new ArrayList<>();
        List<Node> states = new ArrayList<>();
        for (JSONObject record : nodeRecords) {
            Node node = parseNode(record, result);
            if (node == null) {
                continue;
            }
            switch (node.getKind()) {
                case PROCESS:
                    processes.add(node);
                    break;
                case OBJECT:
                    objects.add(node);
                    break;
                default:
                    states.add(node);
                    break;
            }
        }

        insertProcesses(graph, processes, result);
        for (Node object : objects) {
            insert(graph, object, result);
        }
        for (Node state : states) {
            Node parent = graph.findNode(state.getParentObjectId());
            // states inherit the owner of their object and are stored in its frame
            Node aligned = state;
            if (parent != null) {
                Geometry frame = parent.getGeometry();
                aligned = state.withOwningProcess(parent.getOwningProcessId())
                        .withGeometry(state.getGeometry().translate(-frame.getX(), -frame.getY()));
            }
            insert(graph, aligned, result);
        }

        for (JSONObject record : linkRecords) {
            Link link = parseLink(record, allocator, result);
            if (link == null) {
                continue;
            }
            try {
                new AddLinkCommand(graph, link).redo();
            } catch (DiagramException e) {
                result.addError(e.getErrorCode(), e.getMessage(), link.getId(), "link");
            }
        }

        logger.info("Imported " + graph.getNodeCount() + " nodes and " + graph.getLinkCount() + " links, "
                + result.getErrorCount() + " record(s) rejected");
        result.reportErrors();
        return new DiagramImport(graph, allocator, result);
    }

    /**
     * Inserts processes owners-first. Processes that can never be placed because their
     * owners form a loop are reported as cycles.
     */
    private void insertProcesses(DiagramGraph graph, List<Node> processes, ValidationResult result) {
        List<Node> pending = new ArrayList<>(processes);
        boolean progress = true;
        while (progress && !pending.isEmpty()) {
            progress = false;
            Set<String> pendingIds = new HashSet<>();
            for (Node node : pending) {
                pendingIds.add(node.getId());
            }
            Iterator<Node> it = pending.iterator();
            while (it.hasNext()) {
                Node node = it.next();
                String owner = node.getOwningProcessId();
                if (owner == null || graph.containsNode(owner) || !pendingIds.contains(owner)) {
                    insert(graph, node, result);
                    pendingIds.remove(node.getId());
                    it.remove();
                    progress = true;
                }
            }
        }
        for (Node node : pending) {
            result.addError(CycleDetectedException.ERROR_CODE, "Process " + node.getId() + " is nested inside itself via "
                    + node.getOwningProcessId(), node.getId(), "node");
        }
    }

    private void insert(DiagramGraph graph, Node node, ValidationResult result) {
        try {
            new AddNodeCommand(graph, node).redo();
        } catch (DiagramException e) {
            result.addError(e.getErrorCode(), e.getMessage(), node.getId(), "node");
        }
    }

    private Node parseNode(JSONObject record, ValidationResult result) {
        String id = string(record, "id");
        if (id == null || id.isEmpty()) {
            result.addError(MISSING_FIELD, "Node record without id", null, "node");
            return null;
        }
        NodeKind kind = NodeKind.fromWireName(string(record, "kind"));
        if (kind == null) {
            result.addError(UNKNOWN_KIND, "Unknown node kind '" + record.get("kind") + "'", id, "node");
            return null;
        }
        String label = string(record, "label");
        if (label == null) {
            result.addError(MISSING_FIELD, "Node " + id + " has no label", id, "node");
            return null;
        }

        double defaultW = kind == NodeKind.STATE ? EngineConstants.STATE_WIDTH : EngineConstants.NODE_WIDTH;
        double defaultH = kind == NodeKind.STATE ? EngineConstants.STATE_HEIGHT : EngineConstants.NODE_HEIGHT;
        Geometry geometry;
        try {
            double cx = number(record, "x", 0);
            double cy = number(record, "y", 0);
            double w = number(record, "w", defaultW);
            double h = number(record, "h", defaultH);
            geometry = new Geometry(cx - w / 2, cy - h / 2, w, h);
        } catch (IllegalArgumentException e) {
            result.addError(BAD_VALUE, "Node " + id + ": " + e.getMessage(), id, "node");
            return null;
        }

        String owner = emptyToNull(string(record, "parent_process_id"));
        Node node;
        if (kind == NodeKind.STATE) {
            String parent = emptyToNull(string(record, "parent_object_id"));
            if (parent == null) {
                parent = emptyToNull(string(record, "parent_id"));
            }
            if (parent == null) {
                result.addError(MISSING_FIELD, "State " + id + " has no parent object", id, "node");
                return null;
            }
            node = Node.state(id, label, geometry, parent, owner, Boolean.TRUE.equals(record.get("initial")));
        } else {
            node = Node.of(kind, id, label, geometry, owner);
        }

        Essence essence = Essence.fromWireName(string(record, "essence"));
        Affiliation affiliation = Affiliation.fromWireName(string(record, "affiliation"));
        return node.withEssence(essence == null ? Essence.INFORMATICAL : essence)
                .withAffiliation(affiliation == null ? Affiliation.SYSTEMIC : affiliation);
    }

    private Link parseLink(JSONObject record, IdAllocator allocator, ValidationResult result) {
        String id = emptyToNull(string(record, "id"));
        String source = firstPresent(record, "source_id", "src");
        String target = firstPresent(record, "target_id", "dst");
        if (source == null || target == null) {
            result.addError(MISSING_FIELD, "Link " + id + " lacks an endpoint", id, "link");
            return null;
        }
        String kindName = firstPresent(record, "kind", "link_type");
        LinkKind kind = LinkKind.fromWireName(kindName);
        if (kind == null) {
            result.addError(UNKNOWN_KIND, "Unknown link kind '" + kindName + "'", id, "link");
            return null;
        }
        Cardinality sourceCard;
        Cardinality targetCard;
        try {
            sourceCard = Cardinality.parse(string(record, "card_src"));
            targetCard = Cardinality.parse(string(record, "card_dst"));
        } catch (IllegalArgumentException e) {
            result.addError(BAD_CARDINALITY, e.getMessage(), id, "link");
            return null;
        }
        if (id == null) {
            id = allocator.next(IdKind.LINK);
        }
        return new Link(id, kind, source, target, string(record, "label"), sourceCard, targetCard);
    }

    // === helpers ===

    private void checkMeta(Object meta, ValidationResult result) {
        if (!(meta instanceof JSONObject)) {
            logger.debug("Diagram has no meta block, assuming " + FORMAT + " v" + VERSION);
            return;
        }
        Object format = ((JSONObject) meta).get("format");
        if (format != null && !FORMAT.equals(format)) {
            logger.warn("Unexpected diagram format '" + format + "', reading it as " + FORMAT);
        }
    }

    private List<JSONObject> records(JSONObject root, String key, ValidationResult result) {
        List<JSONObject> records = new ArrayList<>();
        Object value = root.get(key);
        if (value == null) {
            return records;
        }
        if (!(value instanceof JSONArray)) {
            result.addError(MALFORMED_DOCUMENT, "'" + key + "' must be an array", null, key);
            return records;
        }
        for (Object item : (JSONArray) value) {
            if (item instanceof JSONObject) {
                records.add((JSONObject) item);
            } else {
                result.addError(MALFORMED_DOCUMENT, "Entry of '" + key + "' is not an object: " + item, null, key);
            }
        }
        return records;
    }

    private static void reserve(IdAllocator allocator, Object id) {
        if (id instanceof String) {
            allocator.reserve((String) id);
        }
    }

    private static String string(JSONObject record, String key) {
        Object value = record.get(key);
        return value == null ? null : value.toString();
    }

    private static String firstPresent(JSONObject record, String key, String fallbackKey) {
        String value = emptyToNull(string(record, key));
        return value != null ? value : emptyToNull(string(record, fallbackKey));
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static double number(JSONObject record, String key, double defaultValue) {
        Object value = record.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new IllegalArgumentException("'" + key + "' is not a number: " + value);
    }
}
