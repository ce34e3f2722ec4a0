// file: src/main/java/io/pagetree/storage/EmbeddedTreeCodec.java
package io.pagetree.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pagetree.core.NodeId;
import io.pagetree.core.Page;
import io.pagetree.core.PageComment;
import io.pagetree.core.PageTree;
import io.pagetree.core.TreeNode;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Carries the page tree inside the page list itself, as one line of page 0's comment.
 * <p>
 * Format:
 * <pre>
 *   &lt;user comment&gt;\n#TREE=&lt;base64(JSON SerializedTree)&gt;
 * </pre>
 * The marker only counts at the start of a line; text such as {@code "see #TREE=notes"}
 * is ordinary comment text. This class writes the marker line last; on read the last
 * marker line wins wherever it sits. The JSON body is {@link SerializedTree}; the older compact form
 * ({@link CompactTreeFormat}) is accepted on read.
 * <p>
 * Failure policy: a marker that cannot be decoded, or that carries a schema version this
 * build does not know, yields "no tree" and leaves the pages untouched.
 */
public final class EmbeddedTreeCodec {

    public static final String MARKER = "#TREE=";

    private static final Logger log = Logger.getLogger(EmbeddedTreeCodec.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private EmbeddedTreeCodec() {}

    /** Pages with the tree removed from page 0, and the tree if one was found. */
    public record Extraction(List<Page> pages, PageTree tree) {
        public boolean hasTree() { return tree != null; }
    }

    // ---------------------------------------------------------------- comment level

    /** Marker line for {@code tree}; empty string for an empty tree. */
    public static String serializeTreeToComment(PageTree tree) {
        if (tree.isEmpty() || tree.rootId() == null) return "";
        var nodes = new ArrayList<SerializedTree.SerializedNode>(tree.size());
        Set<NodeId> written = new HashSet<>();
        for (TreeNode n : tree.preOrder()) {
            nodes.add(toSerialized(n));
            written.add(n.id());
        }
        tree.nodes().values().stream()
                .filter(n -> !written.contains(n.id()))
                .sorted(Comparator.comparing(TreeNode::id))
                .forEach(n -> nodes.add(toSerialized(n)));

        var doc = new SerializedTree(tree.version(), tree.rootId().value(), nodes);
        try {
            byte[] json = MAPPER.writeValueAsBytes(doc);
            return MARKER + Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize tree", e);
        }
    }

    /** Tree carried by {@code comment}, if any can be decoded. */
    public static Optional<PageTree> parseTreeFromComment(String comment) {
        int at = markerLineStart(comment);
        if (at < 0) return Optional.empty();
        int start = at + MARKER.length();
        int end = comment.indexOf('\n', start);
        String payload = (end < 0 ? comment.substring(start) : comment.substring(start, end)).trim();

        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(payload), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.log(Level.WARNING, "Embedded tree is not valid base64; ignoring it", e);
            return Optional.empty();
        }

        if (CompactTreeFormat.looksCompact(decoded)) {
            try {
                return Optional.of(CompactTreeFormat.decode(decoded));
            } catch (IllegalArgumentException e) {
                log.log(Level.WARNING, "Embedded compact tree is malformed; ignoring it", e);
                return Optional.empty();
            }
        }
        return parseJson(decoded);
    }

    /** {@code comment} without its marker line. */
    public static String removeTreeFromComment(String comment) {
        int at = markerLineStart(comment);
        if (at < 0) return comment;
        int end = comment.indexOf('\n', at + MARKER.length());
        if (end >= 0) {
            return comment.substring(0, at) + comment.substring(end + 1);
        }
        int cut = at > 0 && comment.charAt(at - 1) == '\n' ? at - 1 : at;
        return comment.substring(0, cut);
    }

    /** Replace any marker in {@code comment} with one for {@code tree}, as the last line. */
    public static String appendTreeToComment(String comment, PageTree tree) {
        String clean = removeTreeFromComment(comment);
        String line = serializeTreeToComment(tree);
        if (line.isEmpty()) return clean;
        return clean.isEmpty() ? line : clean + "\n" + line;
    }

    // ---------------------------------------------------------------- page level

    /**
     * Copy of {@code pages} whose page 0 carries {@code tree}. When {@code enabled} is false
     * (or there is nothing to carry) page 0 is returned without any marker.
     */
    public static List<Page> embedTreeInPages(List<Page> pages, PageTree tree, boolean enabled) {
        if (pages.isEmpty()) return pages;
        Page first = pages.get(0);
        String comment = first.comment() instanceof PageComment.Text text ? text.text() : "";
        String updated = enabled && tree != null && !tree.isEmpty()
                ? appendTreeToComment(comment, tree)
                : removeTreeFromComment(comment);
        if (first.comment() instanceof PageComment.Text && updated.equals(comment)) return pages;

        var out = new ArrayList<Page>(pages);
        out.set(0, first.withComment(PageComment.text(updated)));
        return List.copyOf(out);
    }

    /** Split the tree (if any) out of page 0's comment. */
    public static Extraction extractTreeFromPages(List<Page> pages) {
        if (pages.isEmpty() || !(pages.get(0).comment() instanceof PageComment.Text text)) {
            return new Extraction(pages, null);
        }
        if (markerLineStart(text.text()) < 0) return new Extraction(pages, null);

        Optional<PageTree> tree = parseTreeFromComment(text.text());
        if (tree.isEmpty()) return new Extraction(pages, null);

        var out = new ArrayList<Page>(pages);
        out.set(0, pages.get(0).withComment(PageComment.text(removeTreeFromComment(text.text()))));
        return new Extraction(List.copyOf(out), tree.get());
    }

    // ---------------------------------------------------------------- helpers

    /** Offset of the last line that starts with {@link #MARKER}, or -1. */
    private static int markerLineStart(String comment) {
        int at = comment.lastIndexOf("\n" + MARKER);
        if (at >= 0) return at + 1;
        return comment.startsWith(MARKER) ? 0 : -1;
    }

    private static Optional<PageTree> parseJson(String json) {
        try {
            JsonNode root = MAPPER.readTree(json);
            if (root == null || !root.isObject()) {
                log.warning("Embedded tree is not a JSON object; ignoring it");
                return Optional.empty();
            }
            int version = root.path("version").asInt(PageTree.CURRENT_VERSION);
            if (version != PageTree.CURRENT_VERSION) {
                log.warning("Embedded tree has unsupported version " + version + "; ignoring it");
                return Optional.empty();
            }
            SerializedTree doc = MAPPER.treeToValue(root, SerializedTree.class);
            if (doc.nodes() == null) {
                log.warning("Embedded tree has no node list; ignoring it");
                return Optional.empty();
            }
            return Optional.of(fromSerialized(doc));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.log(Level.WARNING, "Embedded tree is not valid JSON; ignoring it", e);
            return Optional.empty();
        }
    }

    private static SerializedTree.SerializedNode toSerialized(TreeNode n) {
        var children = new ArrayList<String>(n.childrenIds().size());
        for (NodeId c : n.childrenIds()) children.add(c.value());
        return new SerializedTree.SerializedNode(
                n.id().value(),
                n.parentId() == null ? null : n.parentId().value(),
                n.pageIndex(),
                children);
    }

    private static PageTree fromSerialized(SerializedTree doc) {
        var nodes = new ArrayList<TreeNode>(doc.nodes().size());
        for (SerializedTree.SerializedNode sn : doc.nodes()) {
            if (sn == null) throw new IllegalArgumentException("node list contains a null entry");
            PVector<NodeId> children = TreePVector.empty();
            if (sn.childrenIds() != null) {
                for (String c : sn.childrenIds()) {
                    if (c == null) throw new IllegalArgumentException("node " + sn.id() + " lists a null child");
                    children = children.plus(new NodeId(c));
                }
            }
            NodeId parent = sn.parentId() == null ? null : new NodeId(sn.parentId());
            nodes.add(new TreeNode(new NodeId(sn.id()), sn.pageIndex(), parent, children));
        }
        NodeId root = doc.rootId() == null ? null : new NodeId(doc.rootId());
        return PageTree.of(nodes, root);
    }
}
