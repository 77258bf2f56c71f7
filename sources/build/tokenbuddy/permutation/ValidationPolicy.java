package build.tokenbuddy.permutation;

public enum ValidationPolicy {

    CONTINUE,
    ABORT
}
