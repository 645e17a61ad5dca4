package com.astlens.json;

import com.astlens.ast.Ast;
import com.astlens.ast.NodeId;
import com.astlens.protocol.HostMessage;

/**
 * Interface for writing snapshots and protocol values as JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a snapshot in the same shape {@link AstJsonDeserializer#deserializeAst} reads.
     *
     * @throws AstJsonException if serialization fails
     */
    String serialize(Ast ast) throws AstJsonException;

    /**
     * Serializes a snapshot as pretty-printed JSON.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Ast ast) throws AstJsonException;

    /**
     * Serializes a node reference compactly, for round-tripping through the UI.
     */
    String serializeNodeId(NodeId id) throws AstJsonException;

    /**
     * Serializes an outbound message with its {@code type} discriminator.
     */
    String serializeMessage(HostMessage message) throws AstJsonException;
}
