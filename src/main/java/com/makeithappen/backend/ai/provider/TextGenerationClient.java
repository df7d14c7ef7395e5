package com.makeithappen.backend.ai.provider;

/**
 * External text generation. Single attempt; callers treat any exception as "no result".
 */
public interface TextGenerationClient {

    String providerCode();

    /**
     * @return the model's raw text, possibly empty
     */
    String complete(String systemPrompt, String userPrompt, double temperature) throws Exception;
}
