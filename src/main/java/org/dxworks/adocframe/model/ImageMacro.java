package org.dxworks.adocframe.model;

import java.util.Map;

public class ImageMacro extends Macro {

    private final String source;
    private final String alt;
    private final String title;
    private final Integer width;
    private final Integer height;
    private final String link;
    private final String align;
    private final String floatValue;

    public ImageMacro(String target, Map<String, String> parameters, MacroType macroType) {
        super("image", target, parameters, macroType);
        this.source = getTarget();
        this.alt = parameter("alt", fileStem(source));
        this.title = parameter("title", "");
        this.width = intParameter("width");
        this.height = intParameter("height");
        this.link = parameter("link", "");
        this.align = parameter("align", "");
        this.floatValue = parameter("float", "");
    }

    public String getSource() {
        return source;
    }

    public String getAlt() {
        return alt;
    }

    public String getTitle() {
        return title;
    }

    public Integer getWidth() {
        return width;
    }

    public Integer getHeight() {
        return height;
    }

    public String getLink() {
        return link;
    }

    public String getAlign() {
        return align;
    }

    public String getFloat() {
        return floatValue;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
