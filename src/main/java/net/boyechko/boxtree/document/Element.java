/*
 * CSS-BoxTree - Formatting structure construction for CSS 2.1 layout
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.boxtree.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An element of the source document: a tag name, attributes, the text preceding its first child
 * and an ordered list of child nodes. Text following a child is stored as that child's {@link
 * Node#tail() tail}.
 */
public final class Element extends Node {
    private final String name;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<Node> children = new ArrayList<>();
    private String text = "";

    public Element(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Element name is required");
        }
        this.name = name;
    }

    /** Shorthand used when building trees by hand. */
    public static Element of(String name) {
        return new Element(name);
    }

    public String name() {
        return name;
    }

    /** Text before the first child node, never null. */
    public String text() {
        return text;
    }

    public Element setText(String text) {
        this.text = text != null ? text : "";
        return this;
    }

    public Element withTail(String tail) {
        setTail(tail);
        return this;
    }

    public String attribute(String attributeName) {
        return attributes.get(attributeName);
    }

    public Element setAttribute(String attributeName, String value) {
        attributes.put(attributeName, value);
        return this;
    }

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    /** Returns only the element children, in document order. */
    public List<Element> elementChildren() {
        List<Element> out = new ArrayList<>();
        for (Node child : children) {
            if (child instanceof Element elem) {
                out.add(elem);
            }
        }
        return out;
    }

    public Element appendChild(Node child) {
        if (child.parent() != null) {
            throw new IllegalArgumentException(child + " already belongs to " + child.parent());
        }
        child.setParent(this);
        children.add(child);
        return this;
    }

    /** Appends all given nodes, in order. */
    public Element append(Node... nodes) {
        for (Node node : nodes) {
            appendChild(node);
        }
        return this;
    }

    @Override
    public String toString() {
        return "<" + name + ">";
    }
}
