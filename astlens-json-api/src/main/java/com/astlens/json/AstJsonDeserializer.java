package com.astlens.json;

import com.astlens.ast.Ast;
import com.astlens.ast.NodeId;
import com.astlens.protocol.HostMessage;

/**
 * Interface for reading snapshots and protocol values from JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a complete snapshot.
     *
     * <p>Nodes are single-key objects keyed by their kind tag. Unknown kind tags become
     * {@link com.astlens.ast.UnrecognizedNode}s; unknown fields are ignored. References are
     * not bounds-checked here.</p>
     *
     * @param json the JSON text
     * @return the snapshot
     * @throws AstJsonException if the text is not JSON or does not have the snapshot shape
     */
    Ast deserializeAst(String json) throws AstJsonException;

    /**
     * Deserializes a node reference as carried by a display entry.
     *
     * @throws AstJsonException if the text is not a {@code {group, offset}} object
     */
    NodeId deserializeNodeId(String json) throws AstJsonException;

    /**
     * Deserializes an outbound message by its {@code type} discriminator.
     *
     * @throws AstJsonException if the text is not a known message
     */
    HostMessage deserializeMessage(String json) throws AstJsonException;
}
