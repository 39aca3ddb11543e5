package com.callprobe.instrumenter.host;

import org.eclipse.jdt.core.dom.CompilationUnit;

/**
 * Re-serializes a unit with JDT's flattener. Formatting and comments of the original are not
 * preserved; the output is valid Java equivalent to the tree.
 */
public class SourcePrinter {

    public String print(CompilationUnit unit) {
        return unit.toString();
    }
}
