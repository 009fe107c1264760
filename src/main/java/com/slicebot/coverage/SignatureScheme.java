package com.slicebot.coverage;

import com.slicebot.model.SliceConstraint;

/**
 * Expected query signature for a concrete slice. A blank result disables signature matching.
 */
@FunctionalInterface
public interface SignatureScheme {
    SignatureScheme UNSIGNED = constraint -> "";

    String signatureFor(SliceConstraint constraint);
}
