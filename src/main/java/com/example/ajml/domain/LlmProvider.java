package com.example.ajml.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Supported LLM providers and the LangChain chat class each one is emitted as.
 */
public enum LlmProvider {

    OPENAI("openai", "ChatOpenAI", "langchain_openai"),
    ANTHROPIC("anthropic", "ChatAnthropic", "langchain_anthropic"),
    GOOGLE("google", "ChatGoogleGenerativeAI", "langchain_google_genai"),
    MISTRAL("mistral", "ChatMistralAI", "langchain_mistralai"),
    GROQ("groq", "ChatGroq", "langchain_groq"),
    OLLAMA("ollama", "ChatOllama", "langchain_ollama"),
    AZURE_OPENAI("azure_openai", "AzureChatOpenAI", "langchain_openai"),
    BEDROCK("bedrock", "ChatBedrock", "langchain_aws");

    private final String token;
    private final String chatClass;
    private final String pythonPackage;

    LlmProvider(String token, String chatClass, String pythonPackage) {
        this.token = token;
        this.chatClass = chatClass;
        this.pythonPackage = pythonPackage;
    }

    public String token() {
        return token;
    }

    public String chatClass() {
        return chatClass;
    }

    public String pythonPackage() {
        return pythonPackage;
    }

    public static Optional<LlmProvider> fromToken(String token) {
        return Arrays.stream(values())
                .filter(p -> p.token.equals(token))
                .findFirst();
    }

    public static List<String> sortedTokens() {
        return Arrays.stream(values()).map(LlmProvider::token).sorted().toList();
    }
}
