package org.opmsim.diagram;

import java.util.*;

import org.apache.log4j.Logger;
import org.opmsim.constants.EngineConstants;
import org.opmsim.diagram.clipboard.Clipboard;
import org.opmsim.diagram.clipboard.ClipboardSnapshot;
import org.opmsim.diagram.graph.*;
import org.opmsim.diagram.io.DiagramImport;
import org.opmsim.diagram.model.*;
import org.opmsim.diagram.opl.OplGenerator;
import org.opmsim.diagram.opl.OplImportResult;
import org.opmsim.diagram.opl.OplParser;
import org.opmsim.exceptions.DiagramException;
import org.opmsim.exceptions.InvalidParentException;
import org.opmsim.exceptions.NotFoundException;

/**
 * Entry point for editing one diagram. Every edit is turned into a command and run through
 * the command engine, so it can be undone.
 */
public class DiagramEditor {
    private static final Logger logger = Logger.getLogger(DiagramEditor.class);

    private final DiagramGraph graph;
    private final IdAllocator allocator;
    private final CommandEngine engine;
    private ClipboardSnapshot clipboard = ClipboardSnapshot.EMPTY;

    public DiagramEditor() {
        this(new DiagramGraph(), new IdAllocator(), new CommandEngine());
    }

    public DiagramEditor(DiagramGraph graph, IdAllocator allocator, CommandEngine engine) {
        this.graph = graph;
        this.allocator = allocator;
        this.engine = engine;
    }

    /**
     * Editor over an imported diagram, continuing the imported id sequence.
     */
    public static DiagramEditor of(DiagramImport imported) {
        return new DiagramEditor(imported.getGraph(), imported.getAllocator(), new CommandEngine());
    }

    public DiagramGraph getGraph() {
        return graph;
    }

    public IdAllocator getAllocator() {
        return allocator;
    }

    public CommandEngine getCommandEngine() {
        return engine;
    }

    // === NODES ===

    public String addObject(String label, double x, double y, String owningProcessId) throws DiagramException {
        return addNode(NodeKind.OBJECT, label, defaultGeometry(x, y), owningProcessId);
    }

    public String addProcess(String label, double x, double y, String owningProcessId) throws DiagramException {
        return addNode(NodeKind.PROCESS, label, defaultGeometry(x, y), owningProcessId);
    }

    /**
     * Adds an object or a process. States are added with {@link #addState}.
     *
     * @return the new node's id
     */
    public String addNode(NodeKind kind, String label, Geometry geometry, String owningProcessId)
            throws DiagramException {
        if (kind == NodeKind.STATE) {
            throw new IllegalArgumentException("Use addState to add a state");
        }
        Node node = Node.of(kind, allocator.next(kind), label, geometry, owningProcessId);
        engine.execute(new AddNodeCommand(graph, node));
        return node.getId();
    }

    /**
     * Adds a state to an object. {@code geometry} is relative to the object; null stacks the
     * state below the object's existing states.
     */
    public String addState(String objectId, String label, Geometry geometry, boolean initial)
            throws DiagramException {
        Node object = graph.getNode(objectId);
        if (!object.isObject()) {
            throw new InvalidParentException("Only objects have states, " + objectId + " is a "
                    + object.getKind().getWireName(), objectId);
        }
        Geometry local = geometry;
        if (local == null) {
            int index = graph.statesOf(objectId).size();
            local = new Geometry((object.getGeometry().getWidth() - EngineConstants.STATE_WIDTH) / 2,
                    4 + index * (EngineConstants.STATE_HEIGHT + 4),
                    EngineConstants.STATE_WIDTH, EngineConstants.STATE_HEIGHT);
        }
        Node state = Node.state(allocator.next(IdKind.STATE), label, local, objectId,
                object.getOwningProcessId(), initial);
        engine.execute(new AddNodeCommand(graph, state));
        return state.getId();
    }

    /**
     * Removes a node with its states, nested content and touching links, as one step.
     */
    public void removeNode(String nodeId) throws DiagramException {
        engine.execute(new DeleteElementsCommand(graph, Collections.singletonList(nodeId)));
    }

    public void deleteSelection(Collection<String> elementIds) throws DiagramException {
        if (elementIds.isEmpty()) {
            return;
        }
        engine.execute(new DeleteElementsCommand(graph, elementIds));
    }

    public void moveNode(String nodeId, double x, double y) throws DiagramException {
        engine.execute(new MoveNodeCommand(graph, nodeId, x, y));
    }

    public void resizeNode(String nodeId, double width, double height) throws DiagramException {
        engine.execute(new ResizeNodeCommand(graph, nodeId, width, height));
    }

    /** Relabels a node or a link. */
    public void relabel(String elementId, String label) throws DiagramException {
        engine.execute(new RelabelCommand(graph, elementId, label));
    }

    public void setOwningProcess(String nodeId, String owningProcessId) throws DiagramException {
        engine.execute(new ReparentNodeCommand(graph, nodeId, owningProcessId));
    }

    public void changeAttributes(String nodeId, Essence essence, Affiliation affiliation, Boolean initial)
            throws DiagramException {
        engine.execute(new ChangeAttributesCommand(graph, nodeId, essence, affiliation, initial));
    }

    public void clearAll() throws DiagramException {
        if (graph.isEmpty()) {
            return;
        }
        engine.execute(new ClearAllCommand(graph));
    }

    // === LINKS ===

    public String addLink(LinkKind kind, String sourceId, String targetId) throws DiagramException {
        return addLink(kind, sourceId, targetId, null, null);
    }

    public String addLink(LinkKind kind, String sourceId, String targetId,
                          Cardinality sourceCardinality, Cardinality targetCardinality) throws DiagramException {
        Link link = new Link(allocator.next(IdKind.LINK), kind, sourceId, targetId, "",
                sourceCardinality, targetCardinality);
        engine.execute(new AddLinkCommand(graph, link));
        return link.getId();
    }

    public void removeLink(String linkId) throws DiagramException {
        engine.execute(new RemoveLinkCommand(graph, linkId));
    }

    public void changeLinkKind(String linkId, LinkKind kind) throws DiagramException {
        engine.execute(new ChangeLinkKindCommand(graph, linkId, kind));
    }

    // === CLIPBOARD ===

    public ClipboardSnapshot copy(Collection<String> selectedIds) throws NotFoundException {
        clipboard = Clipboard.copy(graph, selectedIds);
        logger.info("Copied " + clipboard);
        return clipboard;
    }

    public ClipboardSnapshot getClipboard() {
        return clipboard;
    }

    /**
     * Pastes the clipboard shifted by the configured offset.
     *
     * @return original id to pasted id
     */
    public Map<String, String> paste() throws DiagramException {
        return paste(clipboard, EngineConstants.PASTE_OFFSET);
    }

    public Map<String, String> paste(ClipboardSnapshot snapshot, double offset) throws DiagramException {
        if (snapshot.isEmpty()) {
            return Collections.emptyMap();
        }
        PasteCommand command = Clipboard.paste(graph, allocator, snapshot, offset);
        engine.execute(command);
        return command.getIdMapping();
    }

    /**
     * Copy and paste in one undoable step. The clipboard is left as it was.
     */
    public Map<String, String> duplicate(Collection<String> selectedIds) throws DiagramException {
        return duplicate(selectedIds, EngineConstants.PASTE_OFFSET);
    }

    public Map<String, String> duplicate(Collection<String> selectedIds, double offset) throws DiagramException {
        return paste(Clipboard.copy(graph, selectedIds), offset);
    }

    // === OPL ===

    public OplImportResult importOpl(String text) throws DiagramException {
        return importOpl(text, null);
    }

    /**
     * Parses OPL into the given view and applies it as one undoable step.
     */
    public OplImportResult importOpl(String text, String viewProcessId) throws DiagramException {
        OplImportResult result = new OplParser(graph, allocator).parse(text, viewProcessId);
        if (result.hasChanges()) {
            engine.execute(result.getCommand());
        }
        return result;
    }

    public String generateOpl() {
        return new OplGenerator().generate(graph);
    }

    // === HISTORY ===

    public CommandResult undo() throws DiagramException {
        return engine.undo();
    }

    public CommandResult redo() throws DiagramException {
        return engine.redo();
    }

    // === QUERIES ===

    public List<Node> childrenOf(String processId) {
        return graph.childrenOf(processId);
    }

    public List<Link> linksBetween(Set<String> nodeIds) {
        return graph.linksBetween(nodeIds);
    }

    private static Geometry defaultGeometry(double x, double y) {
        return new Geometry(x, y, EngineConstants.NODE_WIDTH, EngineConstants.NODE_HEIGHT);
    }
}
