package com.viffx.Slr.Config;

import com.viffx.Slr.Render.IndentRenderer;
import com.viffx.Slr.Render.ParenRenderer;
import com.viffx.Slr.Render.Renderer;

import java.util.Locale;

public enum RendererKind {
    PAREN,
    INDENT;

    public Renderer create(int indentWidth) {
        return switch (this) {
            case PAREN -> new ParenRenderer();
            case INDENT -> new IndentRenderer(indentWidth);
        };
    }

    /**
     * @throws SettingsException if {@code name} is neither {@code paren} nor {@code indent}
     */
    public static RendererKind of(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SettingsException("Unknown renderer '" + name + "', expected paren or indent", e);
        }
    }
}
