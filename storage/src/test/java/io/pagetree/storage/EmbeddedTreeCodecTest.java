package io.pagetree.storage;

import io.pagetree.core.FieldState;
import io.pagetree.core.NodeId;
import io.pagetree.core.Page;
import io.pagetree.core.PageComment;
import io.pagetree.core.PageTree;
import io.pagetree.core.PageTrees;
import io.pagetree.core.TreeMutations;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddedTreeCodecTest {

    private static List<Page> pages(String firstComment, int n) {
        var out = new java.util.ArrayList<Page>();
        out.add(Page.of(0, new FieldState("f0"), firstComment));
        for (int i = 1; i < n; i++) out.add(Page.of(i, new FieldState("f" + i), "c" + i));
        return out;
    }

    private static PageTree branched() {
        var t = PageTrees.createTreeFromPages(3);
        return TreeMutations.addBranchNode(t, new NodeId("n0"), 3).tree();
    }

    private static String comment(Page p) {
        return ((PageComment.Text) p.comment()).text();
    }

    @Test
    void embed_then_extract_is_the_identity() {
        for (String c : List.of("", "hello", "line one\nline two", "trailing newline\n")) {
            var pages = pages(c, 4);
            var tree = branched();

            var embedded = EmbeddedTreeCodec.embedTreeInPages(pages, tree, true);
            assertTrue(comment(embedded.get(0)).contains(EmbeddedTreeCodec.MARKER));

            var back = EmbeddedTreeCodec.extractTreeFromPages(embedded);
            assertEquals(pages, back.pages(), "comment " + c);
            assertEquals(tree, back.tree());
        }
    }

    @Test
    void embedding_twice_keeps_a_single_marker() {
        var once = EmbeddedTreeCodec.embedTreeInPages(pages("hi", 3), PageTrees.createTreeFromPages(3), true);
        var twice = EmbeddedTreeCodec.embedTreeInPages(once, branched(), true);
        String text = comment(twice.get(0));
        assertEquals(text.indexOf(EmbeddedTreeCodec.MARKER), text.lastIndexOf(EmbeddedTreeCodec.MARKER));
        assertEquals(branched(), EmbeddedTreeCodec.extractTreeFromPages(twice).tree());
    }

    @Test
    void disabled_embedding_strips_stale_markers() {
        var embedded = EmbeddedTreeCodec.embedTreeInPages(pages("hi", 3), PageTrees.createTreeFromPages(3), true);
        var plain = EmbeddedTreeCodec.embedTreeInPages(embedded, PageTrees.createTreeFromPages(3), false);
        assertEquals("hi", comment(plain.get(0)));
    }

    @Test
    void marker_in_the_middle_of_a_comment_is_removed_with_its_line() {
        String line = EmbeddedTreeCodec.serializeTreeToComment(branched());
        assertEquals("top\nbottom", EmbeddedTreeCodec.removeTreeFromComment("top\n" + line + "\nbottom"));
        assertEquals("no marker", EmbeddedTreeCodec.removeTreeFromComment("no marker"));
    }

    @Test
    void pages_without_marker_have_no_tree() {
        var pages = pages("plain", 2);
        var result = EmbeddedTreeCodec.extractTreeFromPages(pages);
        assertFalse(result.hasTree());
        assertSame(pages, result.pages());
    }

    @Test
    void legacy_compact_format_is_decoded() {
        // root slot 0; page 0 has children slots 1 and 2
        String compact = "0;0,-1,1,2;1,0;2,0";
        String line = EmbeddedTreeCodec.MARKER
                + Base64.getEncoder().encodeToString(compact.getBytes(StandardCharsets.UTF_8));
        var result = EmbeddedTreeCodec.extractTreeFromPages(pages("note\n" + line, 3));

        assertTrue(result.hasTree());
        assertEquals("note", comment(result.pages().get(0)));
        assertEquals(List.of(new NodeId("n1"), new NodeId("n2")), result.tree().root().childrenIds());
        assertEquals(compact, CompactTreeFormat.encode(result.tree()));
    }

    @Test
    void unknown_version_leaves_pages_untouched() {
        String json = "{\"version\":2,\"rootId\":\"n0\",\"nodes\":[]}";
        String c = "x\n" + EmbeddedTreeCodec.MARKER
                + Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
        var pages = pages(c, 1);
        var result = EmbeddedTreeCodec.extractTreeFromPages(pages);
        assertNull(result.tree());
        assertSame(pages, result.pages());
    }

    @Test
    void corrupt_payload_yields_no_tree() {
        for (String payload : List.of("%%%not-base64%%%",
                Base64.getEncoder().encodeToString("{broken".getBytes(StandardCharsets.UTF_8)),
                Base64.getEncoder().encodeToString("5;0,-1".getBytes(StandardCharsets.UTF_8)))) {
            var pages = pages(EmbeddedTreeCodec.MARKER + payload, 1);
            var result = EmbeddedTreeCodec.extractTreeFromPages(pages);
            assertFalse(result.hasTree(), payload);
            assertSame(pages, result.pages());
        }
    }

    @Test
    void null_node_entries_count_as_a_corrupt_payload() {
        for (String json : List.of(
                "{\"version\":1,\"rootId\":\"n0\",\"nodes\":[null]}",
                "{\"version\":1,\"rootId\":\"n0\",\"nodes\":[{\"id\":\"n0\",\"pageIndex\":0,\"childrenIds\":[null]}]}")) {
            var pages = pages("x\n" + EmbeddedTreeCodec.MARKER
                    + Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8)), 1);
            var result = EmbeddedTreeCodec.extractTreeFromPages(pages);
            assertFalse(result.hasTree(), json);
            assertSame(pages, result.pages());
        }
    }

    @Test
    void marker_text_inside_a_line_is_ordinary_comment_text() {
        for (String c : List.of("see #TREE=notes", "a\nsee #TREE=notes\nb")) {
            var pages = pages(c, 4);
            var embedded = EmbeddedTreeCodec.embedTreeInPages(pages, branched(), true);
            var back = EmbeddedTreeCodec.extractTreeFromPages(embedded);
            assertEquals(pages, back.pages(), "comment " + c);
            assertEquals(branched(), back.tree());

            assertFalse(EmbeddedTreeCodec.extractTreeFromPages(pages).hasTree());
            assertEquals(c, EmbeddedTreeCodec.removeTreeFromComment(c));
        }
    }
}
