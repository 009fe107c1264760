package com.slicebot.core.diagnostics;

/**
 * 模块说明：CauseCode（enum）。
 * 主要职责：统一检索流程中的错误/结果类别，label 为写入日志与结果对象时使用的稳定文本。
 * 使用建议：新增类别时注意 fromLabel 的兼容性，外部自动化会按 label 解析。
 */
public enum CauseCode {
    NONE("none"),
    NO_CONNECTION("no_connection"),
    NO_EVENT_IDS("no_event_ids"),
    PARTIAL_EVENT_IDS("partial_event_ids"),
    RATE_LIMIT("RATE_LIMIT"),
    EXECUTION_ERROR("EXECUTION_ERROR"),
    MECE_AGGREGATION_ERROR("MECE_AGGREGATION_ERROR"),
    DATA_GAP("data_gap"),
    LOCK_UNAVAILABLE("lock_unavailable"),
    ABORTED("aborted");

    private final String label;

    CauseCode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static CauseCode fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return NONE;
        }
        String target = raw.trim();
        for (CauseCode code : values()) {
            if (code.label.equalsIgnoreCase(target) || code.name().equalsIgnoreCase(target)) {
                return code;
            }
        }
        return EXECUTION_ERROR;
    }
}
