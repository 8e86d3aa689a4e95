package com.spicenet.core.element;

import java.util.List;
import java.util.Map;

/**
 * Creates an element from its local name, its nodes in pin order, its positional
 * arguments and its keyword arguments.
 */
@FunctionalInterface
public interface ElementFactory {

    Element create(String name, List<String> nodes, List<?> args, Map<String, ?> kwargs);
}
