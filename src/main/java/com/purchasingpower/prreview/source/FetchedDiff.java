package com.purchasingpower.prreview.source;

import lombok.Value;

import java.util.Map;

/**
 * Result of a remote fetch: descriptive metadata plus the diff text to parse.
 */
@Value
public class FetchedDiff {
    Map<String, Object> metadata;
    String diffText;
}
