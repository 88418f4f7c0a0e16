package com.geico.poc.kqlcompiler.normalizer;

/**
 * A node of the external tree does not have the shape its position requires.
 * Raised inside the normalizer and caught per operator; never escapes {@link AstNormalizer}.
 */
public class NormalizationException extends RuntimeException {

    public NormalizationException(String message) {
        super(message);
    }
}
