// file: editor/src/main/java/io/pagetree/editor/EditorConfig.java
package io.pagetree.editor;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pagetree.editor.drag.DragMode;
import io.pagetree.editor.dto.JsonEditorConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Editor settings.
 *
 * Supports:
 *  - historyCapacity:        undo entries kept before the oldest is dropped (default 200)
 *  - embedTree:              whether saved documents carry the tree in page 0 (default true)
 *  - buttonDropMovesSubtree: insert/branch/delete button drops act on the whole subtree
 *                            instead of the single node (default false)
 *  - defaultAddMode:         BRANCH or INSERT (default BRANCH)
 *  - defaultDragMode:        ATTACH_SINGLE, ATTACH_BRANCH or REORDER (default ATTACH_SINGLE)
 */
public final class EditorConfig {

    public static final int DEFAULT_HISTORY_CAPACITY = 200;

    private final int historyCapacity;
    private final boolean embedTree;
    private final boolean buttonDropMovesSubtree;
    private final AddMode defaultAddMode;
    private final DragMode defaultDragMode;

    public EditorConfig(
            int historyCapacity,
            boolean embedTree,
            boolean buttonDropMovesSubtree,
            AddMode defaultAddMode,
            DragMode defaultDragMode
    ) {
        if (historyCapacity <= 0) throw new IllegalArgumentException("historyCapacity must be > 0");
        this.historyCapacity = historyCapacity;
        this.embedTree = embedTree;
        this.buttonDropMovesSubtree = buttonDropMovesSubtree;
        this.defaultAddMode = Objects.requireNonNull(defaultAddMode, "defaultAddMode");
        this.defaultDragMode = Objects.requireNonNull(defaultDragMode, "defaultDragMode");
    }

    public static EditorConfig defaults() {
        return new EditorConfig(DEFAULT_HISTORY_CAPACITY, true, false, AddMode.BRANCH, DragMode.ATTACH_SINGLE);
    }

    public static EditorConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonEditorConfig cfg = mapper.readValue(path.toFile(), JsonEditorConfig.class);
            EditorConfig d = defaults();
            return new EditorConfig(
                    cfg.historyCapacity != null ? cfg.historyCapacity : d.historyCapacity,
                    cfg.embedTree != null ? cfg.embedTree : d.embedTree,
                    cfg.buttonDropMovesSubtree != null ? cfg.buttonDropMovesSubtree : d.buttonDropMovesSubtree,
                    cfg.defaultAddMode != null ? parse(AddMode.class, cfg.defaultAddMode) : d.defaultAddMode,
                    cfg.defaultDragMode != null ? parse(DragMode.class, cfg.defaultDragMode) : d.defaultDragMode
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load EditorConfig from " + path, e);
        }
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String raw) {
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + raw, e);
        }
    }

    public int historyCapacity() {
        return historyCapacity;
    }

    public boolean embedTree() {
        return embedTree;
    }

    public boolean buttonDropMovesSubtree() {
        return buttonDropMovesSubtree;
    }

    public AddMode defaultAddMode() {
        return defaultAddMode;
    }

    public DragMode defaultDragMode() {
        return defaultDragMode;
    }
}
