package com.example.ajml.domain;

/**
 * A processing node of an agent graph.
 */
public sealed interface Node permits LlmNode, ActionNode, ScriptNode, SubgraphNode {

    String id();

    int line();
}
