package com.pineparser;

/**
 * Output of the {@link DirectivePreprocessor}.
 *
 * @param source       the input after optional tab expansion, kept for diagnostics
 * @param commentFree  the text handed to the grammar
 * @param version      the first version directive's value, or null
 */
public record PreprocessedSource(String source, String commentFree, String version) {
}
