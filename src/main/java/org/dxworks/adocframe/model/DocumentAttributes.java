package org.dxworks.adocframe.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ordered name/value table used both for document-wide attributes
 * ({@code :name: value} lines) and for the attributes attached to a single element.
 */
public class DocumentAttributes {

    private final Map<String, String> values = new LinkedHashMap<>();

    public String getAttribute(String name) {
        return values.get(name);
    }

    public String getAttribute(String name, String defaultValue) {
        return values.getOrDefault(name, defaultValue);
    }

    public void setAttribute(String name, String value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Attribute name cannot be null or blank");
        }
        values.put(name, value);
    }

    public boolean hasAttribute(String name) {
        return values.containsKey(name);
    }

    public String removeAttribute(String name) {
        return values.remove(name);
    }

    /**
     * Reads an attribute using the boolean convention of attribute lines:
     * {@code true}, {@code 1} and {@code yes} are true, anything else is false.
     */
    public boolean isEnabled(String name) {
        String value = values.get(name);
        return value != null && (value.equalsIgnoreCase("true") || value.equals("1") || value.equalsIgnoreCase("yes"));
    }

    public Set<String> getAttributeNames() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public void putAll(DocumentAttributes other) {
        values.putAll(other.values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }
}
