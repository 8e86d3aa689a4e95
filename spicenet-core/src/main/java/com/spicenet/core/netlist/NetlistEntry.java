package com.spicenet.core.netlist;

import java.util.Objects;

import com.spicenet.core.element.Element;

/**
 * Result of resolving an identifier in a netlist: an element, a model or a node.
 *
 * @param kind what the identifier resolved to
 * @param identifier the identifier looked up
 * @param element the element, when {@code kind} is {@link Kind#ELEMENT}
 * @param model the model, when {@code kind} is {@link Kind#MODEL}
 * @param node the node, when {@code kind} is {@link Kind#NODE}
 */
public record NetlistEntry(
    Kind kind,
    String identifier,
    Element element,
    DeviceModel model,
    Node node
) {
    /**
     * What an identifier resolved to.
     */
    public enum Kind {
        ELEMENT,
        MODEL,
        NODE
    }

    /**
     * Compact constructor with validation.
     */
    public NetlistEntry {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(identifier, "identifier must not be null");
    }

    static NetlistEntry of(Element element) {
        return new NetlistEntry(Kind.ELEMENT, element.name(), element, null, null);
    }

    static NetlistEntry of(DeviceModel model) {
        return new NetlistEntry(Kind.MODEL, model.name(), null, model, null);
    }

    static NetlistEntry of(Node node) {
        return new NetlistEntry(Kind.NODE, node.name(), null, null, node);
    }

    public Element asElement() {
        return require(Kind.ELEMENT, element);
    }

    public DeviceModel asModel() {
        return require(Kind.MODEL, model);
    }

    public Node asNode() {
        return require(Kind.NODE, node);
    }

    private <T> T require(Kind expected, T value) {
        if (kind != expected) {
            throw new IllegalStateException(identifier + " is a " + kind + ", not a " + expected);
        }
        return value;
    }
}
