package org.dxworks.adocframe.model.outline;

import java.util.ArrayList;
import java.util.List;

public class OutlineSection {
    public String heading;
    public int level; // number of '=' in the heading, 0 for the preamble
    public String id;
    public List<OutlineElement> elements = new ArrayList<>();
    public List<OutlineSection> subsections = new ArrayList<>();
}
