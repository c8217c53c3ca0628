package com.fdsl.flow.plan;

/** How an evaluate step treats a list-valued parent. */
public enum FanOut {
    NONE,
    /** Evaluate once per item of the list parent; the result is a list. */
    PER_ITEM,
    /** Bind the whole list as a single value. */
    WHOLE_LIST
}
