package com.zzf.selfpatch.llm;

/**
 * Text-in, text-out access to the language model. Implementations throw
 * {@link OracleException} on transport errors, timeouts and empty replies.
 */
public interface LanguageModelOracle {

    String complete(String prompt, double temperature, int maxTokens);
}
