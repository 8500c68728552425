package com.cdnarchiver.common.errors;

import java.util.List;

/**
 * A candidate file was rejected; {@link #getReasons()} lists every failed check.
 */
public class PolicyDeniedException extends ArchiveException {

    private final List<String> reasons;

    public PolicyDeniedException(List<String> reasons) {
        super(ArchiveErrorKind.POLICY_DENIED, "Archive denied: " + String.join("; ", reasons));
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }
}
