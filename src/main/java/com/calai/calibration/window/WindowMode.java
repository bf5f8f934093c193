package com.calai.calibration.window;

public enum WindowMode {
    /** every day is an anchor, windows overlap */
    SLIDING,
    /** next anchor starts where the chosen window ended */
    NON_OVERLAPPING,
    /** anchors on Sundays */
    WEEKLY_FLEX
}
