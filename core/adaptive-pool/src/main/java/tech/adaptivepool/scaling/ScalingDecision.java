package tech.adaptivepool.scaling;

public enum ScalingDecision {
    SCALE_UP,
    SCALE_DOWN,
    NONE
}
