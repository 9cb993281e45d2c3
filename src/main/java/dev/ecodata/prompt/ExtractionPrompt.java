package dev.ecodata.prompt;

/**
 * A model request for one row: fixed instructions plus the row-specific message.
 *
 * @param systemMessage role and output rules, identical for every row
 * @param userMessage enumerated text, categories, response format and prior examples
 */
public record ExtractionPrompt(String systemMessage, String userMessage) {}
