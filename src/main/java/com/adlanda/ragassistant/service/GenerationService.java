package com.adlanda.ragassistant.service;

/**
 * Produces an answer from an instruction, a grounding context and a question.
 */
public interface GenerationService {

    /**
     * Makes a single synchronous generation call.
     *
     * @param instruction Rules the answer must follow
     * @param context     Numbered grounding block; may be empty
     * @param question    The user's question
     * @return Generated answer text
     * @throws com.adlanda.ragassistant.exception.GenerationException if the model call fails
     */
    String generate(String instruction, String context, String question);
}
