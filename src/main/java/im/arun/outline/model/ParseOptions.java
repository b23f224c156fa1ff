package im.arun.outline.model;

import im.arun.outline.util.TraceLog;
import lombok.Builder;
import lombok.Value;

/**
 * Per-call parse options. Layout hints are forwarded to the resulting forest untouched.
 */
@Value
@Builder
public class ParseOptions {
    LayoutHints layoutHints;
    Integer autoCollapseDepth;
    TraceLog trace;

    public static ParseOptions defaults() {
        return ParseOptions.builder().build();
    }
}
