package org.dxworks.adocframe.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@code name:target[params]} (inline) or {@code name::target[params]} (block) macro.
 * Macros without a dedicated subtype are kept as plain {@code Macro} nodes.
 */
public class Macro extends DocumentElement {

    private final String name;
    private final String target;
    private final Map<String, String> parameters;
    private final MacroType macroType;

    public Macro(String name, String target, Map<String, String> parameters, MacroType macroType) {
        super("macro");
        this.name = name;
        this.target = target == null ? "" : target;
        this.parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.macroType = macroType;
    }

    public String getName() {
        return name;
    }

    public String getTarget() {
        return target;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    public MacroType getMacroType() {
        return macroType;
    }

    protected String parameter(String key, String defaultValue) {
        return parameters.getOrDefault(key, defaultValue);
    }

    protected Integer intParameter(String key) {
        String value = parameters.get(key);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    protected boolean booleanParameter(String key, boolean defaultValue) {
        String value = parameters.get(key);
        if (value == null) {
            return defaultValue;
        }
        return value.equalsIgnoreCase("true") || value.equals("1") || value.equalsIgnoreCase("yes");
    }

    protected static String fileExtension(String path) {
        String fileName = fileName(path);
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1);
    }

    protected static String fileStem(String path) {
        String fileName = fileName(path);
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? fileName : fileName.substring(0, dot);
    }

    private static String fileName(String path) {
        if (path == null) {
            return "";
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return path.substring(slash + 1);
    }

    @Override
    public void accept(DocumentVisitor visitor) {
        visitor.visit(this);
    }
}
