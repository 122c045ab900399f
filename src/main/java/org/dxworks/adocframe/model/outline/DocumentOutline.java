package org.dxworks.adocframe.model.outline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class DocumentOutline {
    public String filePath;
    public String format = "asciidoc";
    public String title; // nullable
    public String author; // nullable
    public Map<String, String> attributes; // document attributes, null when none are set
    public OutlineSection preamble; // blocks before the first section, nullable
    public List<OutlineSection> sections = new ArrayList<>();
}
