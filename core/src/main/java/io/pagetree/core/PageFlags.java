package io.pagetree.core;

/**
 * Per-page rendering/behaviour flags. Only {@code colorize} on page 0 and {@code quiz}
 * on freshly created pages are interpreted by the editor.
 */
public record PageFlags(boolean colorize, boolean lock, boolean mirror, boolean rise, boolean quiz) {

    public static PageFlags defaults() {
        return new PageFlags(true, true, false, false, false);
    }

    public PageFlags withColorize(boolean value) {
        return new PageFlags(value, lock, mirror, rise, quiz);
    }

    public PageFlags withQuiz(boolean value) {
        return new PageFlags(colorize, lock, mirror, rise, value);
    }
}
