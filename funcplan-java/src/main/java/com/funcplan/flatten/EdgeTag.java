package com.funcplan.flatten;

import com.google.gson.annotations.SerializedName;

/**
 * Tags of flattened edges. {@link #LOOP_BACK} is the only tag that closes a cycle.
 */
public enum EdgeTag {
    @SerializedName("seq")       SEQ("seq"),
    @SerializedName("true")      TRUE("true"),
    @SerializedName("false")     FALSE("false"),
    @SerializedName("loop_body") LOOP_BODY("loop_body"),
    @SerializedName("loop_exit") LOOP_EXIT("loop_exit"),
    @SerializedName("loop_back") LOOP_BACK("loop_back"),
    @SerializedName("exception") EXCEPTION("exception");

    private final String wireName;

    EdgeTag(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
