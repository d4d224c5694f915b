package com.graphid.adapter.static_analysis;

/**
 * One import declaration of a compilation unit.
 *
 * @param name     imported name as written, without {@code .*}
 * @param isStatic static import
 * @param asterisk on-demand import
 */
public record ImportRef(String name, boolean isStatic, boolean asterisk) {

    /**
     * Package the import most likely points into. For a plain single-type import that is
     * everything before the last dot; for a static single import the member is dropped as well.
     */
    public String packageName() {
        String target = name;
        if (isStatic && !asterisk) target = parentOf(target);
        if (!asterisk || isStatic) target = parentOf(target);
        return target;
    }

    private static String parentOf(String qualified) {
        int dot = qualified.lastIndexOf('.');
        return dot > 0 ? qualified.substring(0, dot) : qualified;
    }
}
