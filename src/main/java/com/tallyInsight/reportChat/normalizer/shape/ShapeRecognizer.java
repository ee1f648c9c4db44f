package com.tallyInsight.reportChat.normalizer.shape;

import com.tallyInsight.reportChat.normalizer.model.NormalizedTable;

import java.util.Map;

/**
 * One known export layout: a cheap signature check plus an extractor.
 *
 * Recognizers are tried in a fixed priority by
 * {@link com.tallyInsight.reportChat.normalizer.service.ReportNormalizationService};
 * the first one whose extraction yields at least one row wins.
 */
public interface ShapeRecognizer {

    /**
     * @return Short name used in logs and on the produced table
     */
    String getShapeName();

    /**
     * Checks whether the envelope carries this shape's key signature.
     *
     * @param envelope Unwrapped export envelope
     * @return true if extraction should be attempted
     */
    boolean supports(Map<String, Object> envelope);

    /**
     * Flattens the envelope into rows.
     *
     * @param envelope Unwrapped export envelope, never mutated
     * @return Table with the shape's columns; empty rows mean "no match"
     */
    NormalizedTable extract(Map<String, Object> envelope);
}
