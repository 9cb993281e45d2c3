package dev.ecodata.llm;

import dev.ecodata.prompt.ExtractionPrompt;

/**
 * Provider-agnostic model call.
 *
 * <p>Implementations classify failures: {@link ProviderTransientException} for conditions that
 * may clear on retry (timeouts, rate limits, overloaded servers) and {@link
 * ProviderFatalException} for conditions that will not (bad credentials, invalid requests, an
 * unreachable endpoint).
 */
public interface ModelGateway {

  /**
   * Sends the prompt and returns the raw response text.
   *
   * @throws ProviderTransientException if the call failed transiently, after any retries
   * @throws ProviderFatalException if the call can never succeed as configured
   */
  String complete(ExtractionPrompt prompt);
}
