package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;

/**
 * Capability interface for nodes that carry a source position.
 * Diagnostics are attached to the position of the node they concern.
 */
public interface SourceLocatable {

    /**
     * @return The source position, never null.
     */
    SourceInfo source();
}
