package io.pagetree.editor.dto;

/** Raw JSON shape of an editor config file. Missing keys stay null and take defaults. */
public class JsonEditorConfig {
    public Integer historyCapacity;
    public Boolean embedTree;
    public Boolean buttonDropMovesSubtree;
    public String defaultAddMode;
    public String defaultDragMode;
}
