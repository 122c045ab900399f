package org.dxworks.adocframe.model;

import java.util.Map;

/**
 * An {@code include::path[...]} directive. After a successful include the parser replaces
 * it with the included blocks; the macro itself only stays in the tree as a placeholder
 * when the include produced nothing.
 */
public class IncludeMacro extends Macro {

    private final String filePath;
    private final String levelOffset;
    private final String lines;
    private final String tags;
    private final String indent;
    private final boolean optional;

    public IncludeMacro(String target, Map<String, String> parameters, MacroType macroType) {
        super("include", target, parameters, macroType);
        this.filePath = getTarget();
        this.levelOffset = parameter("leveloffset", "");
        this.lines = parameter("lines", "");
        this.tags = parameter("tags", "");
        this.indent = parameter("indent", "");
        this.optional = booleanParameter("optional", false);
    }

    public String getFilePath() {
        return filePath;
    }

    public String getLevelOffset() {
        return levelOffset;
    }

    public String getLines() {
        return lines;
    }

    public String getTags() {
        return tags;
    }

    public String getIndent() {
        return indent;
    }

    public boolean isOptional() {
        return optional;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
