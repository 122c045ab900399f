package org.dxworks.adocframe.model;

public class CodeBlock extends DocumentElement {

    private final String content;
    private final String language;

    public CodeBlock(String content, String language) {
        super("codeblock");
        this.content = content == null ? "" : content;
        this.language = language;
    }

    public String getContent() {
        return content;
    }

    public String getLanguage() {
        return language;
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
