package org.dxworks.adocframe.model.outline;

import java.util.List;
import java.util.Map;

public class OutlineElement {
    public String type; // paragraph, list, list_item, description_list, table, code_block, listing, literal, verse, passthrough, block_quote, sidebar, example, open, admonition, toc, macro, image, video, include
    public Map<String, Object> properties; // optional, e.g. language for code blocks, kind for admonitions
    public List<OutlineElement> children; // optional nested elements (e.g. list -> list_item, sidebar -> paragraph)
}
