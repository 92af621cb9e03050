package com.funcplan.plan;

import com.google.gson.annotations.SerializedName;

/**
 * Closed set of plan node kinds. Serialized names are the ones used in plan.json.
 */
public enum NodeKind {
    @SerializedName("Start")     START("Start"),
    @SerializedName("End")       END("End"),
    @SerializedName("Statement") STATEMENT("Statement"),
    @SerializedName("Call")      CALL("Call"),
    @SerializedName("Assign")    ASSIGN("Assign"),
    @SerializedName("Return")    RETURN("Return"),
    @SerializedName("Break")     BREAK("Break"),
    @SerializedName("Continue")  CONTINUE("Continue"),
    @SerializedName("Raise")     RAISE("Raise"),
    @SerializedName("If")        IF("If"),
    @SerializedName("For")       FOR("For"),
    @SerializedName("While")     WHILE("While"),
    @SerializedName("TryExcept") TRY_EXCEPT("TryExcept"),
    /** Synthesized merge point; only appears in flattened graphs. */
    @SerializedName("Anchor")    ANCHOR("Anchor");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() { return displayName; }

    public boolean isCompound() {
        return this == IF || this == FOR || this == WHILE || this == TRY_EXCEPT;
    }

    public boolean isLoop() {
        return this == FOR || this == WHILE;
    }

    /** Kinds that end a control path of the function. */
    public boolean isTerminal() {
        return this == END || this == RETURN || this == RAISE;
    }
}
