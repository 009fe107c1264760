package com.slicebot.coverage;

/**
 * How a context treats its "other" bucket, which decides whether its values partition the universe.
 * <ul>
 *   <li>ENUMERATED: the listed values (including any listed "other") are exhaustive.</li>
 *   <li>COMPUTED: "other" is a residual that is always expected alongside the listed values.</li>
 *   <li>UNDEFINED: no exhaustiveness claim; never summed into an uncontexted total.</li>
 * </ul>
 */
public enum OtherPolicy {
    ENUMERATED("enumerated"),
    COMPUTED("computed"),
    UNDEFINED("undefined");

    private final String label;

    OtherPolicy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static OtherPolicy fromLabel(String raw) {
        String target = raw == null ? "" : raw.trim().toLowerCase();
        if ("enumerated".equals(target) || "explicit".equals(target) || "null".equals(target)) {
            return ENUMERATED;
        }
        if ("computed".equals(target)) {
            return COMPUTED;
        }
        return UNDEFINED;
    }
}
