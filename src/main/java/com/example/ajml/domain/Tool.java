package com.example.ajml.domain;

import java.util.List;

/**
 * A callable tool declared in an agent's {@code <tools>} block.
 */
public sealed interface Tool permits ApiCallTool, LocalScriptTool, ScriptTool {

    String id();

    String description();

    int line();

    /** Names of the arguments the tool takes; an action node reads each one from the state field of that name. */
    List<String> inputNames();
}
